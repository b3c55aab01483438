/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.assemble;

import java.util.Optional;

/**
 * Identity keys committed so far, mapped to the row id that committed them.
 * Only the writer lane reads or updates it.
 */
public interface DedupIndex {

    /**
     * @return the row id that owns the key, if any
     * @throws Exception if the backing lookup fails
     */
    Optional<String> lookup(IdentityKey key) throws Exception;

    /** Records a confirmed commit. */
    void record(IdentityKey key, String rowId);

    int size();
}
