package org.flatline;

import org.flatline.flow.IndexPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Settings of one jar flattening run. Instances are immutable; use {@link Builder}.
 */
public class FlattenerConfig {

    private static final Logger logger = LoggerFactory.getLogger(FlattenerConfig.class);

    private final Path inputJarPath;
    private final Path outputDir;
    private final List<Path> inputLibs;
    private final List<String> blackList;
    private final List<String> whiteList;
    private final boolean useAnnotations;
    private final Long seed;
    private final IndexPolicy indexPolicy;
    private final boolean lowerSwitches;
    private final boolean verify;

    private FlattenerConfig(Builder builder) {
        this.inputJarPath = builder.inputJarPath;
        this.outputDir = builder.outputDir;
        this.inputLibs = Collections.unmodifiableList(new ArrayList<>(builder.inputLibs));
        this.blackList = Collections.unmodifiableList(new ArrayList<>(builder.blackList));
        this.whiteList = builder.whiteList == null ? null
                : Collections.unmodifiableList(new ArrayList<>(builder.whiteList));
        this.useAnnotations = builder.useAnnotations;
        this.seed = builder.seed;
        this.indexPolicy = builder.indexPolicy;
        this.lowerSwitches = builder.lowerSwitches;
        this.verify = builder.verify;
    }

    public Path getInputJarPath() {
        return inputJarPath;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public List<Path> getInputLibs() {
        return inputLibs;
    }

    public List<String> getBlackList() {
        return blackList;
    }

    /** {@code null} when every class may be processed. */
    public List<String> getWhiteList() {
        return whiteList;
    }

    public boolean isUseAnnotations() {
        return useAnnotations;
    }

    /** {@code null} for a non-reproducible run. */
    public Long getSeed() {
        return seed;
    }

    public IndexPolicy getIndexPolicy() {
        return indexPolicy;
    }

    public boolean isLowerSwitches() {
        return lowerSwitches;
    }

    public boolean isVerify() {
        return verify;
    }

    public void validateAndWarn() {
        if (indexPolicy == IndexPolicy.UNCHECKED) {
            logger.warn("Index policy UNCHECKED: colliding dispatch indices can make a flattened method loop forever");
        }
        if (!lowerSwitches) {
            logger.warn("Switch lowering is disabled; methods containing switches will be skipped");
        }
        if (whiteList != null && whiteList.isEmpty()) {
            logger.warn("White list is empty; no class will be flattened");
        }
        if (seed != null) {
            logger.info("Using fixed seed {}", seed);
        }
    }

    @Override
    public String toString() {
        return String.format("FlattenerConfig{input=%s, outputDir=%s, libs=%d, annotations=%s, seed=%s, "
                        + "indexPolicy=%s, lowerSwitches=%s, verify=%s}",
                inputJarPath, outputDir, inputLibs.size(), useAnnotations, seed, indexPolicy, lowerSwitches, verify);
    }

    public static class Builder {
        private Path inputJarPath;
        private Path outputDir;
        private List<Path> inputLibs = new ArrayList<>();
        private List<String> blackList = new ArrayList<>();
        private List<String> whiteList;
        private boolean useAnnotations = false;
        private Long seed;
        private IndexPolicy indexPolicy = IndexPolicy.UNIQUE;
        private boolean lowerSwitches = true;
        private boolean verify = false;

        public Builder setInputJarPath(Path inputJarPath) {
            this.inputJarPath = inputJarPath;
            return this;
        }

        public Builder setOutputDir(Path outputDir) {
            this.outputDir = outputDir;
            return this;
        }

        public Builder setInputLibs(List<Path> inputLibs) {
            this.inputLibs = inputLibs == null ? new ArrayList<>() : inputLibs;
            return this;
        }

        public Builder setBlackList(List<String> blackList) {
            this.blackList = blackList == null ? new ArrayList<>() : blackList;
            return this;
        }

        public Builder setWhiteList(List<String> whiteList) {
            this.whiteList = whiteList;
            return this;
        }

        public Builder setUseAnnotations(boolean useAnnotations) {
            this.useAnnotations = useAnnotations;
            return this;
        }

        public Builder setSeed(Long seed) {
            this.seed = seed;
            return this;
        }

        public Builder setIndexPolicy(IndexPolicy indexPolicy) {
            this.indexPolicy = indexPolicy;
            return this;
        }

        public Builder setLowerSwitches(boolean lowerSwitches) {
            this.lowerSwitches = lowerSwitches;
            return this;
        }

        public Builder setVerify(boolean verify) {
            this.verify = verify;
            return this;
        }

        public FlattenerConfig build() {
            if (inputJarPath == null) {
                throw new IllegalArgumentException("Input jar path is required");
            }
            if (outputDir == null) {
                throw new IllegalArgumentException("Output directory is required");
            }
            Objects.requireNonNull(indexPolicy, "indexPolicy");
            for (Path lib : inputLibs) {
                if (lib == null) {
                    throw new IllegalArgumentException("Library path must not be null");
                }
            }
            return new FlattenerConfig(this);
        }
    }
}
