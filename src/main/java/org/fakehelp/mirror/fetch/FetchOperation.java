/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.fetch;

import org.fakehelp.mirror.upstream.UpstreamException;

/**
 * One unit of work in a batch, e.g., fetching a player by ally code.
 *
 * @param <I> Input type.
 * @param <R> Result type.
 */
@FunctionalInterface
public interface FetchOperation<I, R> {

  R fetch(I input) throws UpstreamException;

}
