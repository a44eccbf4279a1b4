// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.ledger;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.latent.core.LogSanitizer;
import sh.latent.core.event.BasePathSet;

/**
 * {@link DescriptorStore} that concatenates a journaled base path with the descriptor.
 */
public final class StandardDescriptorStore implements DescriptorStore {

    private static final Logger log = LoggerFactory.getLogger(StandardDescriptorStore.class);

    private final Journal journal;
    private final EventLog events;
    private String basePath;

    public StandardDescriptorStore(final Journal journal, final EventLog events, final String basePath) {
        this.journal = Objects.requireNonNull(journal, "journal");
        this.events = Objects.requireNonNull(events, "events");
        this.basePath = Objects.requireNonNull(basePath, "basePath");
    }

    @Override
    public String basePath() {
        return basePath;
    }

    @Override
    public void setBasePath(final String basePath) {
        Objects.requireNonNull(basePath, "basePath");
        final String previous = this.basePath;
        this.basePath = basePath;
        journal.record(() -> this.basePath = previous);
        events.append(new BasePathSet(basePath));
        log.debug("Base descriptor path set to '{}'", LogSanitizer.inline(basePath));
    }

    @Override
    public String resolve(final String descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        if (basePath.isEmpty() || descriptor.isEmpty()) {
            return descriptor;
        }
        return basePath + descriptor;
    }
}
