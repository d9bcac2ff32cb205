package com.clangbridge.cli;

import com.clangbridge.printer.FunctionSignature;
import com.clangbridge.printer.ParameterSignature;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 读取 JSON 签名描述文件。
 *
 * <pre>
 * { "module": "App",
 *   "aliases": { "Handle": "OpaquePointer" },
 *   "functions": [ { "name": "foo", "returns": "Bool",
 *                    "params": [ { "name": "x", "type": "Int32?" } ] } ] }
 * </pre>
 */
public class SignatureFileReader {

    static final String DEFAULT_MODULE = "Main";

    public SignatureFile read(Path path) throws IOException {
        String json = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        return parse(json, path.getFileName().toString());
    }

    public SignatureFile parse(String json, String source) {
        JsonObject root;
        try {
            JsonElement element = JsonParser.parseString(json);
            if (!element.isJsonObject()) {
                throw new InputFormatException("根节点必须是 JSON 对象", source);
            }
            root = element.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new InputFormatException("JSON 解析失败: " + e.getMessage(), source, e);
        }

        String module = optString(root, "module", source);
        if (module == null || module.isEmpty()) {
            module = DEFAULT_MODULE;
        }

        Map<String, String> aliases = new LinkedHashMap<>();
        if (root.has("aliases")) {
            JsonElement aliasesElement = root.get("aliases");
            if (!aliasesElement.isJsonObject()) {
                throw new InputFormatException("'aliases' 必须是对象", source);
            }
            for (Map.Entry<String, JsonElement> e : aliasesElement.getAsJsonObject().entrySet()) {
                if (!isString(e.getValue())) {
                    throw new InputFormatException("别名 '" + e.getKey() + "' 的目标必须是字符串", source);
                }
                aliases.put(e.getKey(), e.getValue().getAsString());
            }
        }

        SourceTypeResolver resolver = new SourceTypeResolver(module, aliases, source);
        List<FunctionSignature> functions = new ArrayList<>();
        JsonElement functionsElement = root.get("functions");
        if (functionsElement == null || !functionsElement.isJsonArray()) {
            throw new InputFormatException("缺少 'functions' 数组", source);
        }
        for (JsonElement fn : functionsElement.getAsJsonArray()) {
            if (!fn.isJsonObject()) {
                throw new InputFormatException("'functions' 的元素必须是对象", source);
            }
            functions.add(readFunction(fn.getAsJsonObject(), resolver, source));
        }
        return new SignatureFile(module, functions);
    }

    private FunctionSignature readFunction(JsonObject fn, SourceTypeResolver resolver, String source) {
        String name = optString(fn, "name", source);
        if (name == null || name.trim().isEmpty()) {
            throw new InputFormatException("函数缺少 'name'", source);
        }
        FunctionSignature.Builder builder = FunctionSignature.builder(name);

        String returns = optString(fn, "returns", source);
        if (returns != null) {
            ResolvedType ret = resolver.resolve(returns);
            builder.returns(ret.getType(), ret.getOptionality());
        }

        if (fn.has("params")) {
            if (!fn.get("params").isJsonArray()) {
                throw new InputFormatException("函数 '" + name + "' 的 'params' 必须是数组", source);
            }
            JsonArray params = fn.getAsJsonArray("params");
            for (JsonElement p : params) {
                if (!p.isJsonObject()) {
                    throw new InputFormatException("函数 '" + name + "' 的参数必须是对象", source);
                }
                JsonObject param = p.getAsJsonObject();
                String type = optString(param, "type", source);
                if (type == null) {
                    throw new InputFormatException("函数 '" + name + "' 的参数缺少 'type'", source);
                }
                ResolvedType resolved = resolver.resolve(type);
                builder.param(new ParameterSignature(optString(param, "name", source),
                        resolved.getType(), resolved.getOptionality()));
            }
        }
        return builder.build();
    }

    private static String optString(JsonObject obj, String key, String source) {
        JsonElement e = obj.get(key);
        if (e == null || e.isJsonNull()) return null;
        if (!isString(e)) {
            throw new InputFormatException("'" + key + "' 必须是字符串", source);
        }
        return e.getAsString();
    }

    private static boolean isString(JsonElement e) {
        return e.isJsonPrimitive() && e.getAsJsonPrimitive().isString();
    }
}
