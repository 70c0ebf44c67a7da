package com.catmepim.converter.sheetjs.core.writers;

import java.io.IOException;

import com.catmepim.converter.sheetjs.codegen.CompiledSheet;

/**
 * Common interface for writing compiled sheets in one output format (JavaScript source, JSON
 * manifest, CSV report).
 * <p>
 * Writers never close the stream they write to; whoever opened the stream (a file or standard
 * output) closes it.
 *
 * @inv {@link #getSheetsWrittenCount()} equals the number of successful {@link #write} calls
 */
public interface ISheetCodeWriter extends AutoCloseable {

    /**
     * Prepares the writer. Calling it on an open writer has no effect.
     *
     * @throws IOException if the output cannot be prepared
     * @post the writer accepts {@link #write(CompiledSheet)} calls
     */
    void open() throws IOException;

    /**
     * Writes one compiled sheet.
     *
     * @param sheet a fully compiled sheet
     * @throws IOException if writing fails
     * @pre the writer is open; {@code sheet != null}
     */
    void write(CompiledSheet sheet) throws IOException;

    /**
     * Flushes buffered output to the underlying stream.
     *
     * @throws IOException if flushing fails
     */
    void flush() throws IOException;

    /**
     * Completes the output (closing brackets and the like) and flushes it.
     *
     * @throws IOException if completing the output fails
     * @post the writer is no longer usable
     */
    @Override
    void close() throws IOException;

    long getSheetsWrittenCount();
}
