/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.model;

/**
 * Semantic type of a target field. Decides how identity components are canonicalized.
 */
public enum FieldType {
    IDENTIFIER,
    TEXT,
    DATE,
    POSTCODE
}
