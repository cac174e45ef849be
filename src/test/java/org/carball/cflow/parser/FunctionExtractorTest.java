package org.carball.cflow.parser;

import org.carball.cflow.model.function.ExtractionError;
import org.carball.cflow.model.function.ExtractionResult;
import org.carball.cflow.model.function.FunctionUnit;
import org.carball.cflow.model.token.Token;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

public class FunctionExtractorTest {

    private FunctionExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new FunctionExtractor();
    }

    private ExtractionResult extract(String source) {
        return extractor.extract(new Tokenizer(source).tokenize());
    }

    @Test
    void shouldExtractFreeFunctionsInSourceOrder() {
        // Given
        String source = """
            void first() { a(); }
            int second(int x, char *name) { return x; }
            """;

        // When
        ExtractionResult result = extract(source);

        // Then
        assertThat(result.errors()).isEmpty();
        assertThat(result.units()).extracting(FunctionUnit::name).containsExactly("first", "second");
        assertThat(result.units()).extracting(FunctionUnit::index).containsExactly(0, 1);
        assertThat(result.units().get(1).parameters()).containsExactly("x", "name");
        assertThat(result.units().get(1).isMember()).isFalse();
    }

    @Test
    void shouldSliceBodyBetweenBraces() {
        FunctionUnit unit = extract("int f() { return { 1 }; }").units().get(0);

        assertThat(unit.body().stream().map(Token::text).collect(Collectors.joining(" ")))
                .isEqualTo("return { 1 } ;");
    }

    @Test
    void shouldSkipPrototypesAndDeletedFunctions() {
        // Given
        String source = """
            int prototype(int a);
            struct S {
                S(const S&) = delete;
                virtual void pure() = 0;
                void defined() {}
            };
            """;

        // When
        ExtractionResult result = extract(source);

        // Then
        assertThat(result.units()).extracting(FunctionUnit::qualifiedName).containsExactly("S::defined");
    }

    @Test
    void shouldQualifyMembersWithEnclosingScopes() {
        // Given
        String source = """
            namespace geo {
            class Shape : public Base {
            public:
                double area() const { return 0; }
                ~Shape() { }
            };
            }
            int Widget::resize(int w) { return w; }
            """;

        // When
        ExtractionResult result = extract(source);

        // Then
        assertThat(result.units()).extracting(FunctionUnit::qualifiedName)
                .containsExactly("geo::Shape::area", "geo::Shape::~Shape", "Widget::resize");
        assertThat(result.units().get(2).enclosingScope()).isEqualTo("Widget");
    }

    @Test
    void shouldNotTreatTemplateParameterAsScope() {
        // Given
        String source = """
            template <class T>
            T identity(T value) { return value; }
            """;

        // When
        ExtractionResult result = extract(source);

        // Then
        assertThat(result.units()).hasSize(1);
        assertThat(result.units().get(0).qualifiedName()).isEqualTo("identity");
        assertThat(result.units().get(0).parameters()).containsExactly("value");
    }

    @Test
    void shouldAcceptConstructorInitializerList() {
        FunctionUnit unit = extract("Point::Point(int x) : x_(x), y_(0) { init(); }").units().get(0);

        assertThat(unit.qualifiedName()).isEqualTo("Point::Point");
        assertThat(unit.body()).extracting(Token::text).containsExactly("init", "(", ")", ";");
    }

    @Test
    void shouldSkipEnumBodies() {
        ExtractionResult result = extract("enum Color { RED = f(1), GREEN }; void g() {}");

        assertThat(result.units()).extracting(FunctionUnit::name).containsExactly("g");
    }

    @Test
    void shouldExtractParameterNamesFromDefaultsArraysAndFunctionPointers() {
        // When
        FunctionUnit unit = extract(
                "void f(int count = 3, char buf[16], int (*cb)(int), std::map<int, int> m, void) {}")
                .units().get(0);

        // Then
        assertThat(unit.parameters()).containsExactly("count", "buf", "cb", "m");
    }

    @Test
    void shouldNameOperatorOverloads() {
        ExtractionResult result = extract("struct V { V operator+(const V& o) const { return o; } };");

        assertThat(result.units()).extracting(FunctionUnit::qualifiedName).containsExactly("V::operator+");
    }

    @Test
    void shouldRecordErrorForUnterminatedBodyAndKeepScanning() {
        // Given
        String source = """
            int ok() { return 1; }
            int broken() { if (x) {
            """;

        // When
        ExtractionResult result = extract(source);

        // Then
        assertThat(result.units()).extracting(FunctionUnit::name).containsExactly("ok");
        assertThat(result.errors()).hasSize(1);
        ExtractionError error = result.errors().get(0);
        assertThat(error.name()).isEqualTo("broken");
        assertThat(error.index()).isEqualTo(1);
        assertThat(error.message()).contains("unterminated function body");
        assertThat(result.fragmentCount()).isEqualTo(2);
    }

    @Test
    void shouldRecordErrorForUnmatchedParenthesis() {
        ExtractionResult result = extract("int bad(int a { }");

        assertThat(result.units()).isEmpty();
        assertThat(result.errors()).extracting(ExtractionError::message)
                .containsExactly("unmatched '(' in parameter list");
    }

    @Test
    void shouldExtractSampleFixtureFunctions() {
        // Given
        String source = """
            class Calculator {
            public:
                int add(int a, int b) {
                    return a + b;
                }
                int multiply(int x, int y) {
                    if (x == 0 || y == 0) {
                        return 0;
                    }
                    return x * y;
                }
            };
            """;

        // When
        ExtractionResult result = extract(source);

        // Then
        assertThat(result.units()).extracting(FunctionUnit::qualifiedName)
                .containsExactly("Calculator::add", "Calculator::multiply");
        assertThat(result.units()).allMatch(FunctionUnit::isMember);
    }
}
