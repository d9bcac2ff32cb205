package com.clangbridge.cli;

import com.clangbridge.printer.OutputLanguageMode;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * picocli print 子命令：把签名描述文件打印为 C 家族声明
 */
@Command(name = "print", description = "把签名描述文件打印为 C / Objective-C / C++ 声明")
public class PrintCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Mixin
    LoggingOptions logging;

    @Parameters(index = "0", description = "签名描述文件（JSON）")
    Path signatures;

    @Option(names = {"-m", "--mode"}, description = "输出模式，可重复（c, objc, cxx；默认 c 与 cxx）")
    List<String> modes;

    @Option(names = {"-t", "--types"}, description = "已知类型表（JSON）")
    Path types;

    @Option(names = "--unsupported", defaultValue = "comment-out",
            description = "含无法表示类型的声明：emit, comment-out, omit（默认 comment-out）")
    String unsupported;

    @Option(names = "--no-banner", description = "不输出文件头和分组注释")
    boolean noBanner;

    @Option(names = {"-o", "--output"}, description = "输出文件（默认 stdout）")
    Path output;

    @Override
    public Integer call() {
        logging.apply();
        EmitterConfig config = new EmitterConfig();
        try {
            if (modes != null && !modes.isEmpty()) {
                config.setModes(parseModes(modes));
            }
            config.setUnsupportedPolicy(UnsupportedPolicy.fromKey(unsupported));
        } catch (IllegalArgumentException e) {
            spec.commandLine().getErr().println("错误: " + e.getMessage());
            return 2;
        }
        config.setIncludeBanner(!noBanner);
        config.setTypeMappingFile(types);

        return new BridgeRunner(spec.commandLine().getOut(), spec.commandLine().getErr())
                .print(signatures, config, output);
    }

    static Set<OutputLanguageMode> parseModes(List<String> keys) {
        Set<OutputLanguageMode> result = EnumSet.noneOf(OutputLanguageMode.class);
        for (String key : keys) {
            result.add(OutputLanguageMode.fromKey(key));
        }
        return result;
    }
}
