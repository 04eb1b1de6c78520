package dev.devbase.manifest.api;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable inputs of a {@link ResolutionSession}.
 */
public record ResolutionConfiguration(
    Path baseManifest,
    Optional<Path> overlay,
    Optional<Path> miseTemplate,
    PackSelection packs,
    ExecutionContext executionContext,
    DuplicatePolicy duplicatePolicy
) {
    public ResolutionConfiguration {
        Objects.requireNonNull(baseManifest, "baseManifest");
        Objects.requireNonNull(overlay, "overlay");
        Objects.requireNonNull(miseTemplate, "miseTemplate");
        Objects.requireNonNull(packs, "packs");
        Objects.requireNonNull(executionContext, "executionContext");
        Objects.requireNonNull(duplicatePolicy, "duplicatePolicy");
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .baseManifest(baseManifest)
            .overlay(overlay)
            .miseTemplate(miseTemplate)
            .packs(packs)
            .executionContext(executionContext)
            .duplicatePolicy(duplicatePolicy);
    }

    public static final class Builder {
        private Path baseManifest;
        private Optional<Path> overlay = Optional.empty();
        private Optional<Path> miseTemplate = Optional.empty();
        private PackSelection packs = PackSelection.defaults();
        private ExecutionContext executionContext = ExecutionContext.defaults();
        private DuplicatePolicy duplicatePolicy = DuplicatePolicy.KEEP_ALL;

        public Builder baseManifest(Path baseManifest) {
            this.baseManifest = baseManifest;
            return this;
        }

        public Builder overlay(Optional<Path> overlay) {
            this.overlay = overlay;
            return this;
        }

        public Builder overlay(Path overlay) {
            return overlay(Optional.ofNullable(overlay));
        }

        public Builder miseTemplate(Optional<Path> miseTemplate) {
            this.miseTemplate = miseTemplate;
            return this;
        }

        public Builder miseTemplate(Path miseTemplate) {
            return miseTemplate(Optional.ofNullable(miseTemplate));
        }

        public Builder packs(PackSelection packs) {
            this.packs = packs;
            return this;
        }

        public Builder executionContext(ExecutionContext executionContext) {
            this.executionContext = executionContext;
            return this;
        }

        public Builder duplicatePolicy(DuplicatePolicy duplicatePolicy) {
            this.duplicatePolicy = duplicatePolicy;
            return this;
        }

        public ResolutionConfiguration build() {
            return new ResolutionConfiguration(
                baseManifest,
                overlay,
                miseTemplate,
                packs,
                executionContext,
                duplicatePolicy
            );
        }
    }
}
