package com.clangbridge.cli;

import com.clangbridge.printer.KnownTypeInfo;
import com.clangbridge.printer.OutputLanguageMode;
import com.clangbridge.printer.PrimitiveTypeMapping;
import com.clangbridge.types.NominalDecl;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 从 JSON 读写已知类型表。
 *
 * <pre>
 * { "extendsDefault": true,
 *   "c":   { "App.Handle": { "name": "app_handle_t *", "nullable": true },
 *            "App.Celsius": "double" },
 *   "objc": { ... },
 *   "cxx":  { ... } }
 * </pre>
 * 字符串简写表示不可空的类型名。
 */
public class TypeMappingLoader {

    private static final Logger LOG = Logger.getLogger(TypeMappingLoader.class.getName());

    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    public PrimitiveTypeMapping load(Path path) throws IOException {
        String json = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        PrimitiveTypeMapping mapping = parse(json, path.getFileName().toString());
        LOG.fine("已加载类型表 " + path + "，共 " + mapping.size() + " 条");
        return mapping;
    }

    public PrimitiveTypeMapping parse(String json, String source) {
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

        boolean extendsDefault = true;
        JsonElement ext = root.get("extendsDefault");
        if (ext != null) {
            if (!ext.isJsonPrimitive() || !ext.getAsJsonPrimitive().isBoolean()) {
                throw new InputFormatException("'extendsDefault' 必须是布尔值", source);
            }
            extendsDefault = ext.getAsBoolean();
        }
        PrimitiveTypeMapping.Builder builder = extendsDefault
                ? PrimitiveTypeMapping.createDefault().toBuilder()
                : PrimitiveTypeMapping.builder();

        for (Map.Entry<String, JsonElement> partition : root.entrySet()) {
            if (partition.getKey().equals("extendsDefault")) continue;
            OutputLanguageMode mode;
            try {
                mode = OutputLanguageMode.fromKey(partition.getKey());
            } catch (IllegalArgumentException e) {
                throw new InputFormatException(e.getMessage(), source, e);
            }
            if (!partition.getValue().isJsonObject()) {
                throw new InputFormatException("分区 '" + partition.getKey() + "' 必须是对象", source);
            }
            for (Map.Entry<String, JsonElement> entry : partition.getValue().getAsJsonObject().entrySet()) {
                builder.put(mode, parseDecl(entry.getKey(), source), parseInfo(entry, source));
            }
        }
        return builder.build();
    }

    /** 把表序列化为与 {@link #parse} 相同格式的 JSON */
    public String toJson(PrimitiveTypeMapping mapping) {
        return toJson(mapping, EnumSet.allOf(OutputLanguageMode.class));
    }

    /** 只序列化指定分区 */
    public String toJson(PrimitiveTypeMapping mapping, Set<OutputLanguageMode> modes) {
        JsonObject root = new JsonObject();
        root.addProperty("extendsDefault", false);
        for (OutputLanguageMode mode : OutputLanguageMode.values()) {
            if (!modes.contains(mode)) continue;
            JsonObject partition = new JsonObject();
            for (Map.Entry<NominalDecl, KnownTypeInfo> e : mapping.getEntries(mode).entrySet()) {
                KnownTypeInfo info = e.getValue();
                if (info.canBeNullable()) {
                    JsonObject obj = new JsonObject();
                    obj.addProperty("name", info.getName());
                    obj.addProperty("nullable", true);
                    partition.add(e.getKey().getQualifiedName(), obj);
                } else {
                    partition.add(e.getKey().getQualifiedName(), new JsonPrimitive(info.getName()));
                }
            }
            root.add(mode.getKey(), partition);
        }
        return gson.toJson(root);
    }

    private static NominalDecl parseDecl(String key, String source) {
        try {
            return NominalDecl.parse(key);
        } catch (IllegalArgumentException e) {
            throw new InputFormatException(e.getMessage() + "（应为 Module.Name）", source, e);
        }
    }

    private static KnownTypeInfo parseInfo(Map.Entry<String, JsonElement> entry, String source) {
        JsonElement value = entry.getValue();
        if (value.isJsonPrimitive() && value.getAsJsonPrimitive().isString()) {
            return new KnownTypeInfo(value.getAsString(), false);
        }
        if (!value.isJsonObject()) {
            throw new InputFormatException("类型 '" + entry.getKey() + "' 的映射必须是字符串或对象", source);
        }
        JsonObject obj = value.getAsJsonObject();
        JsonElement name = obj.get("name");
        if (name == null || !name.isJsonPrimitive() || !name.getAsJsonPrimitive().isString()
                || name.getAsString().trim().isEmpty()) {
            throw new InputFormatException("类型 '" + entry.getKey() + "' 缺少 'name'", source);
        }
        boolean nullable = false;
        JsonElement n = obj.get("nullable");
        if (n != null) {
            if (!n.isJsonPrimitive() || !n.getAsJsonPrimitive().isBoolean()) {
                throw new InputFormatException("类型 '" + entry.getKey() + "' 的 'nullable' 必须是布尔值", source);
            }
            nullable = n.getAsBoolean();
        }
        return new KnownTypeInfo(name.getAsString(), nullable);
    }
}
