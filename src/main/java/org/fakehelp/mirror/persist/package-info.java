/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

/** This package stores documents as JSON files below the data path.
 * <p>{@code DataStore} reads and writes single documents, one file per
 * collection, language, version record, or lookup table.
 * {@code SelfHealingStore} wraps it for collection reads that trigger a
 * forced synchronization when the stored collection is missing, broken, or
 * of another version than expected.</p>
 */
package org.fakehelp.mirror.persist;
