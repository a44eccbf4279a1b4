// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.core.event;

import java.util.Objects;

/**
 * The administrator changed the base path prepended to descriptors.
 */
public record BasePathSet(String basePath) implements LedgerEvent {

    public BasePathSet {
        Objects.requireNonNull(basePath, "basePath");
    }
}
