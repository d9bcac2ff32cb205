package com.clangbridge.cli;

import com.clangbridge.printer.KnownTypeInfo;
import com.clangbridge.printer.OutputLanguageMode;
import com.clangbridge.printer.PrimitiveTypeMapping;
import com.clangbridge.types.NominalDecl;
import com.clangbridge.types.Types;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.EnumSet;

import static org.assertj.core.api.Assertions.*;

@DisplayName("类型表加载测试")
class TypeMappingLoaderTest {

    private final TypeMappingLoader loader = new TypeMappingLoader();

    @Test
    @DisplayName("扩展默认表并按分区登记")
    void loadsFixture() throws Exception {
        Path path = Paths.get(getClass().getResource("/types/app-types.json").toURI());
        PrimitiveTypeMapping mapping = loader.load(path);

        NominalDecl celsius = new NominalDecl("App", "Celsius");
        assertThat(mapping.lookup(celsius, OutputLanguageMode.C)).contains(new KnownTypeInfo("celsius_t", false));
        assertThat(mapping.lookup(celsius, OutputLanguageMode.CXX)).contains(new KnownTypeInfo("app::Celsius", false));
        assertThat(mapping.lookup(celsius, OutputLanguageMode.OBJC)).isEmpty();
        assertThat(mapping.lookup(Types.INT32.getDecl(), OutputLanguageMode.C).get().getName()).isEqualTo("int32_t");
    }

    @Test
    @DisplayName("extendsDefault 为 false 时只含文件中的条目")
    void replacesDefault() {
        PrimitiveTypeMapping mapping = loader.parse(
                "{\"extendsDefault\": false, \"objc\": {\"App.Handle\": {\"name\": \"AppHandle *\", \"nullable\": true}}}",
                "t.json");
        assertThat(mapping.size()).isEqualTo(1);
        assertThat(mapping.lookup(new NominalDecl("App", "Handle"), OutputLanguageMode.OBJC))
                .contains(new KnownTypeInfo("AppHandle *", true));
        assertThat(mapping.lookup(Types.INT32.getDecl(), OutputLanguageMode.C)).isEmpty();
    }

    @Test
    @DisplayName("toJson 与 parse 互逆")
    void jsonRoundTrip() {
        PrimitiveTypeMapping original = PrimitiveTypeMapping.createDefault();
        PrimitiveTypeMapping reloaded = loader.parse(loader.toJson(original), "dump.json");
        for (OutputLanguageMode mode : OutputLanguageMode.values()) {
            assertThat(reloaded.getEntries(mode)).isEqualTo(original.getEntries(mode));
        }
    }

    @Test
    @DisplayName("toJson 可只输出部分分区")
    void partialDump() {
        String json = loader.toJson(PrimitiveTypeMapping.createDefault(), EnumSet.of(OutputLanguageMode.OBJC));
        assertThat(json).contains("\"objc\"").contains("NSInteger").doesNotContain("\"cxx\"");
    }

    @Test
    @DisplayName("格式错误被拒绝")
    void malformed() {
        assertThatThrownBy(() -> loader.parse("{\"rust\": {}}", "t.json"))
                .isInstanceOf(InputFormatException.class).hasMessageContaining("rust");
        assertThatThrownBy(() -> loader.parse("{\"c\": {\"Int32\": \"int\"}}", "t.json"))
                .isInstanceOf(InputFormatException.class).hasMessageContaining("Module.Name");
        assertThatThrownBy(() -> loader.parse("{\"c\": {\"App.X\": {\"nullable\": true}}}", "t.json"))
                .isInstanceOf(InputFormatException.class).hasMessageContaining("name");
        assertThatThrownBy(() -> loader.parse("{\"c\": {\"App.X\": {\"name\": \"x\", \"nullable\": \"yes\"}}}", "t.json"))
                .isInstanceOf(InputFormatException.class);
        assertThatThrownBy(() -> loader.parse("{\"extendsDefault\": 1}", "t.json"))
                .isInstanceOf(InputFormatException.class);
        assertThatThrownBy(() -> loader.parse("nope{", "t.json"))
                .isInstanceOf(InputFormatException.class);
    }
}
