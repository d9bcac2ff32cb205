package com.clangbridge.cli;

import com.clangbridge.printer.FunctionSignaturePrinter;
import com.clangbridge.printer.OutputLanguageMode;
import com.clangbridge.printer.PrimitiveTypeMapping;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * print / table 子命令的执行器，返回进程退出码
 */
public class BridgeRunner {

    private static final Logger LOG = Logger.getLogger(BridgeRunner.class.getName());

    private final PrintWriter out;
    private final PrintWriter err;

    public BridgeRunner(PrintWriter out, PrintWriter err) {
        this.out = out;
        this.err = err;
    }

    /**
     * 打印签名文件中的全部声明到 output（为 null 时写 stdout）
     */
    public int print(Path signatures, EmitterConfig config, Path output) {
        if (!Files.exists(signatures)) {
            err.println("错误: 文件不存在 - " + signatures);
            return 1;
        }
        try {
            PrimitiveTypeMapping mapping = loadTypeMapping(config.getTypeMappingFile());
            SignatureFile file = new SignatureFileReader().read(signatures);
            DeclarationEmitter emitter = new DeclarationEmitter(new FunctionSignaturePrinter(mapping), config);
            String text = emitter.emit(file);

            if (output != null) {
                Files.write(output, text.getBytes(StandardCharsets.UTF_8));
            } else {
                out.print(text);
                out.flush();
            }
            if (emitter.getUnsupportedCount() > 0) {
                err.println("警告: " + emitter.getUnsupportedCount() + " 条声明含无法表示的类型");
            }
            return 0;
        } catch (InputFormatException e) {
            err.println("输入错误: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            LOG.log(Level.WARNING, "读写失败: " + signatures, e);
            err.println("错误: " + e.getMessage());
            return 1;
        }
    }

    /**
     * 以 JSON 输出生效的已知类型表
     */
    public int dumpTable(Path typeMappingFile, Set<OutputLanguageMode> modes) {
        try {
            PrimitiveTypeMapping mapping = loadTypeMapping(typeMappingFile);
            out.println(new TypeMappingLoader().toJson(mapping, modes));
            out.flush();
            return 0;
        } catch (InputFormatException e) {
            err.println("输入错误: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            LOG.log(Level.WARNING, "读取类型表失败: " + typeMappingFile, e);
            err.println("错误: " + e.getMessage());
            return 1;
        }
    }

    private PrimitiveTypeMapping loadTypeMapping(Path file) throws IOException {
        if (file == null) {
            return PrimitiveTypeMapping.createDefault();
        }
        if (!Files.exists(file)) {
            throw new InputFormatException("类型表文件不存在", file.toString());
        }
        return new TypeMappingLoader().load(file);
    }
}
