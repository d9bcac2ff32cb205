package com.clangbridge.cli;

import com.clangbridge.printer.OutputLanguageMode;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 声明输出配置
 */
public class EmitterConfig {
    private Set<OutputLanguageMode> modes = EnumSet.of(OutputLanguageMode.C, OutputLanguageMode.CXX);
    private UnsupportedPolicy unsupportedPolicy = UnsupportedPolicy.COMMENT_OUT;
    private boolean includeBanner = true;
    private Path typeMappingFile;

    public EmitterConfig() {
    }

    public Set<OutputLanguageMode> getModes() {
        return Collections.unmodifiableSet(modes);
    }

    public void setModes(Set<OutputLanguageMode> modes) {
        if (modes == null || modes.isEmpty()) {
            throw new IllegalArgumentException("至少需要一个输出模式");
        }
        this.modes = EnumSet.copyOf(modes);
    }

    public UnsupportedPolicy getUnsupportedPolicy() {
        return unsupportedPolicy;
    }

    public void setUnsupportedPolicy(UnsupportedPolicy unsupportedPolicy) {
        this.unsupportedPolicy = unsupportedPolicy;
    }

    public boolean isIncludeBanner() {
        return includeBanner;
    }

    public void setIncludeBanner(boolean includeBanner) {
        this.includeBanner = includeBanner;
    }

    public Path getTypeMappingFile() {
        return typeMappingFile;
    }

    public void setTypeMappingFile(Path typeMappingFile) {
        this.typeMappingFile = typeMappingFile;
    }
}
