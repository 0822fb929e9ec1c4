package org.pragmatica.monostyle.token;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.monostyle.token.TokenKind.*;

class TokenizerTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "class A {\n\tvoid M ()\n\t{\n\t\tcall (a, b);\n\t}\n}\n",
            "var s = \"unterminated\nclass B {}",
            "/* open comment without end",
            "x = 'a' + @\"verb\"\"atim\" + $\"{a + \"b\"} and {{braces}}\";\r\n",
            "#if DEBUG\n\tLog ();\n#endif\n",
            "a = b >> 2; c <<= 1; d = e ?? f; g?.h ();\t \n",
            "int x = 1 # 2; été = \"ünicode\";",
            "/// <summary>Doc</summary>\n// line\n/* block\n spanning */ x;"
    })
    void detokenize_reproducesInput_forAnyText(String text) {
        assertThat(Tokenizer.tokenize(text)
                            .detokenize()).isEqualTo(text);
    }

    @Test
    void tokenize_distinguishesCallGenericAndIndexer() {
        assertThat(kinds("f (x)")).containsExactly(IDENTIFIER, OPEN_PAREN, IDENTIFIER, CLOSE_PAREN, END_OF_FILE);
        assertThat(kinds("List<int> ()")).containsExactly(IDENTIFIER,
                                                          GENERIC_OPEN,
                                                          KEYWORD,
                                                          GENERIC_CLOSE,
                                                          OPEN_PAREN,
                                                          CLOSE_PAREN,
                                                          END_OF_FILE);
        assertThat(kinds("a [0]")).containsExactly(IDENTIFIER, OPEN_BRACKET, NUMBER, CLOSE_BRACKET, END_OF_FILE);
    }

    @Test
    void tokenize_treatsLessThanAsComparison_whenNoTypeListFollows() {
        assertThat(kinds("a < b")).containsExactly(IDENTIFIER, BINARY_OPERATOR, IDENTIFIER, END_OF_FILE);
        assertThat(kinds("a < b && c > d")).doesNotContain(GENERIC_OPEN, GENERIC_CLOSE);
    }

    @Test
    void tokenize_recognizesNestedGenerics() {
        var tokens = Tokenizer.tokenize("Dictionary<string, List<int>> map;");

        assertThat(kinds(tokens)).containsExactly(IDENTIFIER,
                                                  GENERIC_OPEN,
                                                  KEYWORD,
                                                  COMMA,
                                                  IDENTIFIER,
                                                  GENERIC_OPEN,
                                                  KEYWORD,
                                                  GENERIC_CLOSE,
                                                  GENERIC_CLOSE,
                                                  IDENTIFIER,
                                                  SEMICOLON,
                                                  END_OF_FILE);
        assertThat(tokens.matching(1)).isEqualTo(8);
        assertThat(tokens.matching(5)).isEqualTo(7);
    }

    @Test
    void tokenize_turnsUnterminatedStringIntoErrorTokenCoveringRemainder() {
        var tokens = Tokenizer.tokenize("var s = \"abc\nnext;");
        var error = tokens.get(3);

        assertThat(error.kind()).isEqualTo(ERROR);
        assertThat(error.text()).isEqualTo("\"abc\nnext;");
        assertThat(tokens.get(4)
                         .kind()).isEqualTo(END_OF_FILE);
    }

    @Test
    void tokenize_splitsTriviaBetweenTrailingAndLeading() {
        var tokens = Tokenizer.tokenize("a; // note\n// own line\nb;");
        var semicolon = tokens.get(1);
        var next = tokens.get(2);

        assertThat(semicolon.trailing()).extracting(Trivia::kind)
                                        .containsExactly(Trivia.Kind.WHITESPACE,
                                                         Trivia.Kind.LINE_COMMENT,
                                                         Trivia.Kind.NEWLINE);
        assertThat(next.leading()).extracting(Trivia::kind)
                                  .containsExactly(Trivia.Kind.LINE_COMMENT, Trivia.Kind.NEWLINE);
        assertThat(next.text()).isEqualTo("b");
    }

    @Test
    void tokenize_keepsPreprocessorLinesAsTrivia() {
        var tokens = Tokenizer.tokenize("#region Setup\nx;\n#endregion\n");

        assertThat(tokens.get(0)
                         .leading()).extracting(Trivia::kind)
                                    .contains(Trivia.Kind.PREPROCESSOR);
        assertThat(kinds(tokens)).containsExactly(IDENTIFIER, SEMICOLON, END_OF_FILE);
    }

    @Test
    void tokenizer_isRestartable() {
        var tokenizer = Tokenizer.tokenizer("if (a) b ();");
        var first = new ArrayList<Token>();
        var second = new ArrayList<Token>();
        tokenizer.forEach(first::add);
        tokenizer.forEach(second::add);

        assertThat(second).isEqualTo(first);
        assertThat(first).hasSize(9);
    }

    @Test
    void tokenSequence_reportsLinesAndIndentation() {
        var tokens = Tokenizer.tokenize("class A {\n\tint x;\n}");

        assertThat(tokens.line(3)).isEqualTo(2);
        assertThat(tokens.isFirstOnLine(3)).isTrue();
        assertThat(tokens.isFirstOnLine(4)).isFalse();
        assertThat(tokens.indentationOf(4)).isEqualTo("\t");
        assertThat(tokens.gapText(2)).isEqualTo("\n\t");
    }

    private static List<TokenKind> kinds(String text) {
        return kinds(Tokenizer.tokenize(text));
    }

    private static List<TokenKind> kinds(TokenSequence tokens) {
        return tokens.tokens()
                     .stream()
                     .map(Token::kind)
                     .toList();
    }
}
