// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.ledger;

import java.util.Objects;

import sh.latent.core.types.Address;

/**
 * Configuration for a {@link DeferredMintLedger}.
 *
 * <p><strong>Usage Example:</strong>
 * <pre>{@code
 * var options = LedgerOptions.builder()
 *     .admin(new Address("0x..."))
 *     .baseDescriptorPath("ipfs://")
 *     .build();
 * var ledger = DeferredMintLedger.create(options);
 * }</pre>
 */
public final class LedgerOptions {

    /** Default administrator: nobody. */
    public static final Address DEFAULT_ADMIN = Address.ZERO;

    /** Default base descriptor path: none. */
    public static final String DEFAULT_BASE_DESCRIPTOR_PATH = "";

    private static final LedgerOptions DEFAULTS = new LedgerOptions(
            DEFAULT_ADMIN,
            DEFAULT_BASE_DESCRIPTOR_PATH);

    private final Address admin;
    private final String baseDescriptorPath;

    private LedgerOptions(final Address admin, final String baseDescriptorPath) {
        this.admin = admin;
        this.baseDescriptorPath = baseDescriptorPath;
    }

    public static LedgerOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** The administrator allowed to change the base descriptor path. */
    public Address admin() {
        return admin;
    }

    /** The path initially prepended to descriptors. */
    public String baseDescriptorPath() {
        return baseDescriptorPath;
    }

    @Override
    public String toString() {
        return "LedgerOptions{admin=" + admin.value()
                + ", baseDescriptorPath='" + baseDescriptorPath + "'}";
    }

    /**
     * Builder for {@link LedgerOptions}.
     */
    public static final class Builder {

        private Address admin = DEFAULT_ADMIN;
        private String baseDescriptorPath = DEFAULT_BASE_DESCRIPTOR_PATH;

        private Builder() {
        }

        public Builder admin(final Address admin) {
            this.admin = Objects.requireNonNull(admin, "admin");
            return this;
        }

        public Builder baseDescriptorPath(final String baseDescriptorPath) {
            this.baseDescriptorPath = Objects.requireNonNull(baseDescriptorPath, "baseDescriptorPath");
            return this;
        }

        public LedgerOptions build() {
            return new LedgerOptions(admin, baseDescriptorPath);
        }
    }
}
