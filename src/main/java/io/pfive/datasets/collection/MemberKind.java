// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.collection;

public enum MemberKind {
    GRID, TABLE, COLLECTION
}
