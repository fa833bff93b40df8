package com.corpusindex.text;

import com.corpusindex.config.IndexerConfig;
import com.corpusindex.config.TokenizerMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TokenizerTest {

    @Test
    @DisplayName("AlphanumericTokenizer: 简单英文分词并转小写")
    void testAlphanumericTokenizerSimple() {
        AlphanumericTokenizer tokenizer = new AlphanumericTokenizer(false, 1);

        List<Token> tokens = tokenizer.tokenize("Hello World");

        assertEquals(2, tokens.size());
        assertToken(tokens.get(0), "hello", 0, 0, 5);
        assertToken(tokens.get(1), "world", 1, 6, 11);
    }

    @Test
    @DisplayName("AlphanumericTokenizer: 停用词过滤后位置连续")
    void testAlphanumericTokenizerWithStopWords() {
        AlphanumericTokenizer tokenizer = new AlphanumericTokenizer(true, 1);

        List<Token> tokens = tokenizer.tokenize("The quick brown fox");

        assertEquals(3, tokens.size());
        assertToken(tokens.get(0), "quick", 0, 4, 9);
        assertToken(tokens.get(1), "brown", 1, 10, 15);
        assertToken(tokens.get(2), "fox", 2, 16, 19);
    }

    @Test
    @DisplayName("AlphanumericTokenizer: 非字母数字字符一律视为分隔符")
    void testAlphanumericTokenizerSeparators() {
        AlphanumericTokenizer tokenizer = new AlphanumericTokenizer(false, 1);

        List<Token> tokens = tokenizer.tokenize("A-1 bb, Ccc! don't");

        assertEquals(6, tokens.size());
        assertToken(tokens.get(0), "a", 0, 0, 1);
        assertToken(tokens.get(1), "1", 1, 2, 3);
        assertToken(tokens.get(2), "bb", 2, 4, 6);
        assertToken(tokens.get(3), "ccc", 3, 8, 11);
        assertToken(tokens.get(4), "don", 4, 13, 16);
        assertToken(tokens.get(5), "t", 5, 17, 18);
    }

    @Test
    @DisplayName("AlphanumericTokenizer: 最短词长过滤")
    void testAlphanumericTokenizerMinTermLength() {
        AlphanumericTokenizer tokenizer = new AlphanumericTokenizer(false, 2);

        List<Token> tokens = tokenizer.tokenize("A-1 bb, Ccc!");

        assertEquals(2, tokens.size());
        assertToken(tokens.get(0), "bb", 0, 4, 6);
        assertToken(tokens.get(1), "ccc", 1, 8, 11);
    }

    @Test
    @DisplayName("AlphanumericTokenizer: Unicode 字母按 Locale.ROOT 转小写")
    void testAlphanumericTokenizerUnicodeLetters() {
        AlphanumericTokenizer tokenizer = new AlphanumericTokenizer(false, 1);

        List<Token> tokens = tokenizer.tokenize("Naïve RÉSUMÉ, 2024");

        assertEquals(List.of("naïve", "résumé", "2024"), tokens.stream().map(Token::term).toList());
    }

    @Test
    @DisplayName("AlphanumericTokenizer: 非法最短词长被拒绝")
    void testAlphanumericTokenizerRejectsInvalidMinLength() {
        assertThrows(IllegalArgumentException.class, () -> new AlphanumericTokenizer(false, 0));
    }

    @Test
    @DisplayName("AlphanumericTokenizer: CJK 连续片段整体成词")
    void testAlphanumericTokenizerKeepsCjkRunWhole() {
        AlphanumericTokenizer tokenizer = new AlphanumericTokenizer(false, 1);

        List<Token> tokens = tokenizer.tokenize("索引流水线，Pipeline!");

        assertEquals(2, tokens.size());
        assertToken(tokens.get(0), "索引流水线", 0, 0, 5);
        assertToken(tokens.get(1), "pipeline", 1, 6, 14);
    }

    @Test
    @DisplayName("AlphanumericTokenizer: 罗马数字与上标数字属于词字符")
    void testAlphanumericTokenizerNumberCategories() {
        AlphanumericTokenizer tokenizer = new AlphanumericTokenizer(false, 1);

        List<Token> tokens = tokenizer.tokenize("Ⅻ x² ½");

        assertEquals(List.of("ⅻ", "x²", "½"), tokens.stream().map(Token::term).toList());
    }

    @Test
    @DisplayName("CompositeTokenizer: 纯中文按码点输出重叠双字")
    void testCompositeTokenizerChineseBigrams() {
        CompositeTokenizer tokenizer = new CompositeTokenizer(false, 1);

        List<Token> tokens = tokenizer.tokenize("搜索引擎");

        assertEquals(3, tokens.size());
        assertToken(tokens.get(0), "搜索", 0, 0, 2);
        assertToken(tokens.get(1), "索引", 1, 1, 3);
        assertToken(tokens.get(2), "引擎", 2, 2, 4);
    }

    @Test
    @DisplayName("CompositeTokenizer: 词内部在 CJK 与非 CJK 交界处切开")
    void testCompositeTokenizerSplitsMixedWord() {
        CompositeTokenizer tokenizer = new CompositeTokenizer(false, 1);

        List<Token> tokens = tokenizer.tokenize("A中B文C");

        assertEquals(List.of("a", "中", "b", "文", "c"), tokens.stream().map(Token::term).toList());
        assertToken(tokens.get(1), "中", 1, 1, 2);
    }

    @Test
    @DisplayName("CompositeTokenizer: 增补平面汉字按码点组成双字")
    void testCompositeTokenizerSupplementaryCodePoints() {
        CompositeTokenizer tokenizer = new CompositeTokenizer(false, 1);

        List<Token> tokens = tokenizer.tokenize("𠀀𠀁字");

        assertEquals(2, tokens.size());
        assertToken(tokens.get(0), "𠀀𠀁", 0, 0, 4);
        assertToken(tokens.get(1), "𠀁字", 1, 2, 5);
    }

    @Test
    @DisplayName("CompositeTokenizer: 最短词长同样作用于双字与单字")
    void testCompositeTokenizerMinTermLength() {
        CompositeTokenizer tokenizer = new CompositeTokenizer(false, 2);

        List<Token> tokens = tokenizer.tokenize("中 文字 x");

        assertEquals(List.of("文字"), tokens.stream().map(Token::term).toList());
        assertEquals(0, tokens.get(0).position());
    }

    @Test
    @DisplayName("CompositeTokenizer: 中英混合分词")
    void testCompositeTokenizerMixedLanguage() {
        CompositeTokenizer tokenizer = new CompositeTokenizer(false, 1);

        List<Token> tokens = tokenizer.tokenize("Hello 世界");

        assertEquals(2, tokens.size());
        assertToken(tokens.get(0), "hello", 0, 0, 5);
        assertToken(tokens.get(1), "世界", 1, 6, 8);
    }

    @Test
    @DisplayName("CompositeTokenizer: 全局位置连续")
    void testCompositeTokenizerGlobalPosition() {
        CompositeTokenizer tokenizer = new CompositeTokenizer(false, 1);

        List<Token> tokens = tokenizer.tokenize("Go 搜索 engine 引擎");

        assertEquals(4, tokens.size());
        assertToken(tokens.get(0), "go", 0, 0, 2);
        assertToken(tokens.get(1), "搜索", 1, 3, 5);
        assertToken(tokens.get(2), "engine", 2, 6, 12);
        assertToken(tokens.get(3), "引擎", 3, 13, 15);
    }

    @Test
    @DisplayName("CompositeTokenizer: 停用词与偏移")
    void testCompositeTokenizerOffsets() {
        CompositeTokenizer tokenizer = new CompositeTokenizer(true, 1);

        List<Token> tokens = tokenizer.tokenize("The, A! 搜索-Engine");

        assertEquals(2, tokens.size());
        assertToken(tokens.get(0), "搜索", 0, 8, 10);
        assertToken(tokens.get(1), "engine", 1, 11, 17);
    }

    @Test
    @DisplayName("CompositeTokenizer: 边界情况")
    void testCompositeTokenizerEdgeCases() {
        CompositeTokenizer tokenizer = new CompositeTokenizer(true, 1);

        assertTrue(tokenizer.tokenize(null).isEmpty());
        assertTrue(tokenizer.tokenize("").isEmpty());
        assertTrue(tokenizer.tokenize("...,,,!!!").isEmpty());

        List<Token> tokens = tokenizer.tokenize("123, 中文, 45");
        assertEquals(3, tokens.size());
        assertToken(tokens.get(0), "123", 0, 0, 3);
        assertToken(tokens.get(1), "中文", 1, 5, 7);
        assertToken(tokens.get(2), "45", 2, 9, 11);
    }

    @Test
    @DisplayName("TokenizerFactory: 默认规则把 CJK 片段整体成词，双字规则需显式开启")
    void testTokenizerFactorySelectsMode() {
        IndexerConfig config = IndexerConfig.defaults();
        Tokenizer standard = TokenizerFactory.fromConfig(config);
        assertInstanceOf(AlphanumericTokenizer.class, standard);
        assertEquals(List.of("索引流水线"), terms(standard, "索引流水线"));

        config.setTokenizerMode(TokenizerMode.COMPOSITE);
        Tokenizer bigram = TokenizerFactory.fromConfig(config);
        assertInstanceOf(CompositeTokenizer.class, bigram);
        assertEquals(List.of("索引", "引流", "流水", "水线"), terms(bigram, "索引流水线"));
    }

    @Test
    @DisplayName("TokenizerFactory: 自定义停用词表按小写匹配")
    void testTokenizerFactoryCustomStopWords() {
        IndexerConfig config = IndexerConfig.defaults();
        config.setStopWords(List.of("Pipeline", "索引"));
        assertEquals(List.of("pipeline", "the", "索引"), terms(TokenizerFactory.fromConfig(config), "Pipeline the 索引"));

        config.setEnableStopWords(true);
        assertEquals(List.of("the"), terms(TokenizerFactory.fromConfig(config), "Pipeline the 索引"));

        config.setStopWords(List.of());
        assertEquals(List.of("pipeline", "索引"), terms(TokenizerFactory.fromConfig(config), "Pipeline the 索引"));
    }

    @Test
    @DisplayName("StopWords: 构造时归一化并忽略空白项")
    void testStopWords() {
        StopWords custom = StopWords.of(List.of(" Foo ", "", "BAR"));

        assertEquals(2, custom.size());
        assertTrue(custom.contains("foo"));
        assertTrue(custom.contains("bar"));
        assertTrue(StopWords.english().contains("the"));
        assertTrue(StopWords.none().isEmpty());
        assertThrows(IllegalArgumentException.class, () -> StopWords.of(null));
        assertThrows(IllegalArgumentException.class, () -> new TermNormalizer(StopWords.none(), 0));
    }

    private static List<String> terms(Tokenizer tokenizer, String text) {
        return tokenizer.tokenize(text).stream().map(Token::term).toList();
    }

    private void assertToken(Token token, String term, int position, int startOffset, int endOffset) {
        assertEquals(term, token.term());
        assertEquals(position, token.position());
        assertEquals(startOffset, token.startOffset());
        assertEquals(endOffset, token.endOffset());
    }
}
