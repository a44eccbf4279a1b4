// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.ledger;

/**
 * Resolves token descriptors to full metadata locations ({@code tokenURI}).
 */
public interface DescriptorStore {

    /** Returns the path prepended to descriptors, empty when unset. */
    String basePath();

    /**
     * Replaces the base path. Authorization is the caller's concern; see {@link AdminGate}.
     */
    void setBasePath(String basePath);

    /**
     * Returns {@code basePath() + descriptor}, or the descriptor alone when no base
     * path is set.
     */
    String resolve(String descriptor);
}
