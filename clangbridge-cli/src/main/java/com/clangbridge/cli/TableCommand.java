package com.clangbridge.cli;

import com.clangbridge.printer.OutputLanguageMode;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * picocli table 子命令：输出生效的已知类型表
 */
@Command(name = "table", description = "以 JSON 输出生效的已知类型表")
public class TableCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Mixin
    LoggingOptions logging;

    @Option(names = {"-t", "--types"}, description = "已知类型表（JSON），缺省为内置表")
    Path types;

    @Option(names = {"-m", "--mode"}, description = "只输出指定分区，可重复（c, objc, cxx）")
    List<String> modes;

    @Override
    public Integer call() {
        logging.apply();
        Set<OutputLanguageMode> selected = EnumSet.allOf(OutputLanguageMode.class);
        if (modes != null && !modes.isEmpty()) {
            try {
                selected = PrintCommand.parseModes(modes);
            } catch (IllegalArgumentException e) {
                spec.commandLine().getErr().println("错误: " + e.getMessage());
                return 2;
            }
        }
        return new BridgeRunner(spec.commandLine().getOut(), spec.commandLine().getErr())
                .dumpTable(types, selected);
    }
}
