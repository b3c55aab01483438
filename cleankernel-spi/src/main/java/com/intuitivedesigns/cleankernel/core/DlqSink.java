/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.core;

import com.intuitivedesigns.cleankernel.model.RawRow;
import com.intuitivedesigns.cleankernel.model.RowOutcome;

/**
 * Audit destination for rows that did not reach the store.
 *
 * <p>The orchestrator calls this once per rejected row with the outcome and the row as it was
 * read, so every rejection can be traced back to its input. A failing dead-letter write is
 * logged by the orchestrator and never changes the row's outcome.</p>
 */
public interface DlqSink extends AutoCloseable {

    void write(RowOutcome outcome, RawRow row) throws Exception;

    default void flush() throws Exception {
    }

    @Override
    default void close() throws Exception {
        flush();
    }
}
