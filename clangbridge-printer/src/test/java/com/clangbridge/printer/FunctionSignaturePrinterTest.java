package com.clangbridge.printer;

import com.clangbridge.types.NominalDecl;
import com.clangbridge.types.OptionalKind;
import com.clangbridge.types.TypeNode;
import com.clangbridge.types.Types;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.*;

@DisplayName("函数签名打印测试")
class FunctionSignaturePrinterTest {

    private FunctionSignaturePrinter printer;

    @BeforeEach
    void setUp() {
        // 与场景描述一致的最小表：Int32 → int32_t, Bool → bool，均不可空
        PrimitiveTypeMapping mapping = PrimitiveTypeMapping.builder()
                .scalar("Int32", "int32_t")
                .scalar("Bool", "bool")
                .build();
        printer = new FunctionSignaturePrinter(mapping);
    }

    private String c(FunctionSignature sig) {
        return printer.printAsCCompatibleDeclaration(sig).getText();
    }

    private String cxx(FunctionSignature sig) {
        return printer.printAsCxxDeclaration(sig).getText();
    }

    @Nested
    @DisplayName("典型场景")
    class Scenarios {

        @Test
        @DisplayName("A: foo(x: Int32) -> Bool")
        void scenarioA() {
            FunctionSignature sig = FunctionSignature.builder("foo")
                    .returns(Types.BOOL)
                    .param("x", Types.INT32)
                    .build();
            assertThat(c(sig)).isEqualTo("bool foo(int32_t x)");
            assertThat(cxx(sig)).isEqualTo("bool foo(int32_t x)");
        }

        @Test
        @DisplayName("B: bar() -> Void")
        void scenarioB() {
            FunctionSignature sig = FunctionSignature.builder("bar").returns(Types.VOID).build();
            assertThat(c(sig)).isEqualTo("void bar(void)");
            assertThat(cxx(sig)).isEqualTo("void bar()");
        }

        @Test
        @DisplayName("C: baz(_: Int32) 匿名参数")
        void scenarioC() {
            FunctionSignature sig = FunctionSignature.builder("baz").anonymousParam(Types.INT32).build();
            assertThat(c(sig)).isEqualTo("void baz(int32_t)");
            assertThat(cxx(sig)).isEqualTo("void baz(int32_t _1)");
        }

        @Test
        @DisplayName("D: qux(x: Int32?) 可选性被丢弃")
        void scenarioD() {
            FunctionSignature sig = FunctionSignature.builder("qux")
                    .param("x", Types.INT32, OptionalKind.OPTIONAL)
                    .build();
            PrintedDeclaration cDecl = printer.printAsCCompatibleDeclaration(sig);
            PrintedDeclaration cxxDecl = printer.printAsCxxDeclaration(sig);

            assertThat(cDecl.getText()).isEqualTo("void qux(int32_t x)");
            assertThat(cxxDecl.getText()).isEqualTo("void qux(int32_t x)");
            assertThat(cDecl.hasDroppedOptionality()).isTrue();
            assertThat(cDecl.isUsable()).isTrue();
        }

        @Test
        @DisplayName("E: quux(x: UnmappedStruct) 得到占位注释，不抛异常")
        void scenarioE() {
            FunctionSignature sig = FunctionSignature.builder("quux")
                    .param("x", Types.nominal("App", "UnmappedStruct"))
                    .build();
            PrintedDeclaration decl = printer.printAsCCompatibleDeclaration(sig);

            assertThat(decl.getText()).isEqualTo("void quux(/* UnmappedStruct */ x)");
            assertThat(decl.isUsable()).isFalse();
            assertThat(decl.getUnrepresentableTypes()).containsExactly("UnmappedStruct");
            assertThat(cxx(sig)).isEqualTo("void quux(/* UnmappedStruct */ x)");
        }
    }

    @Nested
    @DisplayName("参数列表")
    class Parameters {

        @Test
        @DisplayName("匿名参数按 1 起的位置命名，位置计入具名参数")
        void anonymousNamingUsesPosition() {
            FunctionSignature sig = FunctionSignature.builder("mix")
                    .anonymousParam(Types.INT32)
                    .param("flag", Types.BOOL)
                    .anonymousParam(Types.BOOL)
                    .build();
            assertThat(c(sig)).isEqualTo("void mix(int32_t, bool flag, bool)");
            assertThat(cxx(sig)).isEqualTo("void mix(int32_t _1, bool flag, bool _3)");
        }

        @Test
        @DisplayName("任意个数的匿名参数在 C++ 中都得到 _i")
        void manyAnonymous() {
            FunctionSignature.Builder builder = FunctionSignature.builder("many");
            StringBuilder expectedC = new StringBuilder("void many(");
            StringBuilder expectedCxx = new StringBuilder("void many(");
            for (int i = 1; i <= 12; i++) {
                builder.anonymousParam(Types.INT32);
                if (i > 1) {
                    expectedC.append(", ");
                    expectedCxx.append(", ");
                }
                expectedC.append("int32_t");
                expectedCxx.append("int32_t _").append(i);
            }
            FunctionSignature sig = builder.build();
            assertThat(c(sig)).isEqualTo(expectedC.append(')').toString());
            assertThat(cxx(sig)).isEqualTo(expectedCxx.append(')').toString());
        }

        @Test
        @DisplayName("空串参数名视为匿名")
        void emptyNameIsAnonymous() {
            FunctionSignature sig = FunctionSignature.builder("f")
                    .param(new ParameterSignature("", Types.INT32, OptionalKind.NONE))
                    .build();
            assertThat(c(sig)).isEqualTo("void f(int32_t)");
            assertThat(cxx(sig)).isEqualTo("void f(int32_t _1)");
        }

        @Test
        @DisplayName("参数名 \"_\" 视为匿名")
        void underscoreNameIsAnonymous() {
            FunctionSignature sig = FunctionSignature.builder("h")
                    .param("_", Types.INT32)
                    .build();
            assertThat(sig.getParameters().get(0).isAnonymous()).isTrue();
            assertThat(c(sig)).isEqualTo("void h(int32_t)");
            assertThat(cxx(sig)).isEqualTo("void h(int32_t _1)");
        }

        @Test
        @DisplayName("合成的 _i 与声明的名字重复时追加后缀，声明的名字保持不变")
        void synthesizedNameAvoidsDeclaredName() {
            FunctionSignature sig = FunctionSignature.builder("g")
                    .anonymousParam(Types.INT32)
                    .param("_1", Types.INT32)
                    .build();
            PrintedDeclaration decl = printer.printAsCxxDeclaration(sig);
            assertThat(decl.getText()).isEqualTo("void g(int32_t _1_1, int32_t _1)");
            assertThat(decl.isUsable()).isTrue();
            assertThat(c(sig)).isEqualTo("void g(int32_t, int32_t _1)");
        }

        @Test
        @DisplayName("合法化后重名的参数得到唯一名字")
        void legalizedNamesStayUnique() {
            FunctionSignature sig = FunctionSignature.builder("g")
                    .param("int", Types.INT32)
                    .param("int_", Types.INT32)
                    .param("a-b", Types.BOOL)
                    .param("a_b", Types.BOOL)
                    .build();
            assertThat(c(sig)).isEqualTo("void g(int32_t int_, int32_t int__1, bool a_b, bool a_b_1)");
            assertThat(cxx(sig)).isEqualTo("void g(int32_t int_, int32_t int__1, bool a_b, bool a_b_1)");
        }

        @Test
        @DisplayName("参数名经过标识符合法化")
        void parameterNamesLegalized() {
            FunctionSignature sig = FunctionSignature.builder("g")
                    .param("int", Types.INT32)
                    .param("class", Types.BOOL)
                    .build();
            assertThat(c(sig)).isEqualTo("void g(int32_t int_, bool class_)");
            assertThat(cxx(sig)).isEqualTo("void g(int32_t int_, bool class_)");
        }

        @Test
        @DisplayName("可替换标识符打印协作者")
        void customIdentifierPrinter() {
            FunctionSignaturePrinter upper = new FunctionSignaturePrinter(printer.getTypeMapping(),
                    (os, name) -> os.append(name.toUpperCase()));
            FunctionSignature sig = FunctionSignature.builder("h").param("value", Types.INT32).build();
            assertThat(upper.printAsCCompatibleDeclaration(sig).getText()).isEqualTo("void h(int32_t VALUE)");
        }

        @Test
        @DisplayName("多个无法表示的类型按出现顺序记录")
        void unrepresentableOrder() {
            FunctionSignature sig = FunctionSignature.builder("draw")
                    .returns(Types.nominal("App", "Image"))
                    .param("shape", Types.nominal("App", "Shape"))
                    .param("points", Types.opaque("[Point]"))
                    .build();
            PrintedDeclaration decl = printer.printAsCxxDeclaration(sig);
            assertThat(decl.getText()).isEqualTo("/* Image */ draw(/* Shape */ shape, /* [Point] */ points)");
            assertThat(decl.getUnrepresentableTypes()).containsExactly("Image", "Shape", "[Point]");
        }
    }

    @Nested
    @DisplayName("默认表与方言")
    class DefaultTable {

        private final FunctionSignaturePrinter defaultPrinter =
                new FunctionSignaturePrinter(PrimitiveTypeMapping.createDefault());

        @Test
        @DisplayName("Objective-C 表与 C 表共享 C 兼容规则")
        void objcPartition() {
            FunctionSignature sig = FunctionSignature.builder("f")
                    .returns(Types.INT)
                    .param("flag", Types.BOOL)
                    .build();
            assertThat(defaultPrinter.printAsCCompatibleDeclaration(sig, OutputLanguageMode.OBJC).getText())
                    .isEqualTo("NSInteger f(BOOL flag)");
            assertThat(defaultPrinter.printAsCCompatibleDeclaration(sig).getText())
                    .isEqualTo("ptrdiff_t f(bool flag)");
            assertThat(defaultPrinter.printAsCxxDeclaration(sig).getText())
                    .isEqualTo("swift::Int f(bool flag)");
        }

        @Test
        @DisplayName("可空返回值与参数在 C 中带标注，在 C++ 中不带")
        void nullablePointers() {
            FunctionSignature sig = FunctionSignature.builder("make")
                    .returns(Types.OPAQUE_POINTER, OptionalKind.OPTIONAL)
                    .param("raw", Types.UNSAFE_MUTABLE_RAW_POINTER, OptionalKind.IMPLICITLY_UNWRAPPED)
                    .param("size", Types.CLONG)
                    .build();
            assertThat(defaultPrinter.printAsCCompatibleDeclaration(sig).getText())
                    .isEqualTo("void * _Nullable make(void * _Null_unspecified raw, long size)");
            assertThat(defaultPrinter.printAsCxxDeclaration(sig).getText())
                    .isEqualTo("void * make(void * raw, long size)");
        }

        @Test
        @DisplayName("print 按模式分派")
        void printDispatch() {
            FunctionSignature sig = FunctionSignature.builder("tick").build();
            assertThat(defaultPrinter.print(sig, OutputLanguageMode.C).getText()).isEqualTo("void tick(void)");
            assertThat(defaultPrinter.print(sig, OutputLanguageMode.OBJC).getText()).isEqualTo("void tick(void)");
            assertThat(defaultPrinter.print(sig, OutputLanguageMode.CXX).getText()).isEqualTo("void tick()");
            assertThat(defaultPrinter.print(sig, OutputLanguageMode.OBJC).getMode()).isEqualTo(OutputLanguageMode.OBJC);
        }

        @Test
        @DisplayName("C 兼容入口拒绝 CXX 模式")
        void cEntryRejectsCxx() {
            FunctionSignature sig = FunctionSignature.builder("tick").build();
            assertThatThrownBy(() -> defaultPrinter.printAsCCompatibleDeclaration(sig, OutputLanguageMode.CXX))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("输出缓冲")
    class Sink {

        @Test
        @DisplayName("声明追加到调用方缓冲末尾")
        void appendsToSink() {
            StringBuilder os = new StringBuilder("extern ");
            FunctionSignature sig = FunctionSignature.builder("foo").returns(Types.BOOL).param("x", Types.INT32).build();
            PrintedDeclaration decl = printer.printAsCCompatibleDeclaration(sig, os);
            assertThat(os.toString()).isEqualTo("extern bool foo(int32_t x)");
            assertThat(decl.toString()).isEqualTo("bool foo(int32_t x)");

            printer.printAsCxxDeclaration(sig, os.append("; "));
            assertThat(os.toString()).isEqualTo("extern bool foo(int32_t x); bool foo(int32_t x)");
        }

        @Test
        @DisplayName("契约违规时缓冲保持不变")
        void sinkUntouchedOnViolation() {
            StringBuilder os = new StringBuilder("prefix ");
            FunctionSignature sig = FunctionSignature.builder("pair")
                    .param("p", Types.tuple(Types.INT32, Types.INT32))
                    .build();
            assertThatThrownBy(() -> printer.printAsCxxDeclaration(sig, os))
                    .isInstanceOf(ContractViolationException.class);
            assertThat(os.toString()).isEqualTo("prefix ");
        }

        @Test
        @DisplayName("同一个打印器可被多线程共享")
        void sharedAcrossThreads() throws Exception {
            FunctionSignaturePrinter shared = new FunctionSignaturePrinter(PrimitiveTypeMapping.createDefault());
            ExecutorService pool = Executors.newFixedThreadPool(4);
            try {
                List<Future<String>> results = new ArrayList<>();
                for (int i = 0; i < 64; i++) {
                    final TypeNode param = (i % 2 == 0) ? Types.INT32 : Types.CINT;
                    final String name = "fn" + i;
                    results.add(pool.submit(() -> shared.printAsCCompatibleDeclaration(
                            FunctionSignature.builder(name).param("v", param).build()).getText()));
                }
                for (int i = 0; i < results.size(); i++) {
                    String expectedType = (i % 2 == 0) ? "int32_t" : "int";
                    assertThat(results.get(i).get()).isEqualTo("void fn" + i + "(" + expectedType + " v)");
                }
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("签名模型")
    class Model {

        @Test
        @DisplayName("函数名不能为空")
        void blankNameRejected() {
            assertThatThrownBy(() -> FunctionSignature.builder("  ").build())
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new FunctionSignature(null, Types.VOID, OptionalKind.NONE,
                    Collections.<ParameterSignature>emptyList()))
                    .isInstanceOf(NullPointerException.class);
        }

        @Test
        @DisplayName("默认返回 Void，参数列表不可修改")
        void defaults() {
            FunctionSignature sig = FunctionSignature.builder("f").param("x", Types.INT32).build();
            assertThat(sig.getReturnType()).isSameAs(Types.VOID);
            assertThat(sig.getReturnOptionality()).isEqualTo(OptionalKind.NONE);
            assertThatThrownBy(() -> sig.getParameters().clear())
                    .isInstanceOf(UnsupportedOperationException.class);
            assertThat(sig.toString()).isEqualTo("func f(x: Int32) -> Void");
        }

        @Test
        @DisplayName("自定义声明可在表中登记后打印")
        void customNominal() {
            NominalDecl point = new NominalDecl("App", "Point");
            PrimitiveTypeMapping table = PrimitiveTypeMapping.builder()
                    .put(OutputLanguageMode.C, point, new KnownTypeInfo("struct app_point", false))
                    .build();
            FunctionSignature sig = FunctionSignature.builder("origin")
                    .returns(Types.nominal("App", "Point"))
                    .build();
            FunctionSignaturePrinter p = new FunctionSignaturePrinter(table);
            assertThat(p.printAsCCompatibleDeclaration(sig).getText()).isEqualTo("struct app_point origin(void)");
            assertThat(p.printAsCxxDeclaration(sig).getText()).isEqualTo("/* Point */ origin()");
        }
    }
}
