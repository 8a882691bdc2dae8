// SPDX-License-Identifier: Apache-2.0
package org.hiero.interledger.commitment.proof;

/**
 * A proof against a single tree: either a key/value pair is present or a key is absent.
 */
public sealed interface TreeProof permits ExistenceProof, NonExistenceProof {}
