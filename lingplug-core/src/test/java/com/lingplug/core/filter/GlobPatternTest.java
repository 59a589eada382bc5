package com.lingplug.core.filter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GlobPattern 单元测试")
class GlobPatternTest {

    @Test
    @DisplayName("星号匹配任意字符，包括点号")
    void star() {
        GlobPattern pattern = GlobPattern.compile("com.example.*");

        assertTrue(pattern.matches("com.example.A"));
        assertTrue(pattern.matches("com.example.sub.B"));
        assertFalse(pattern.matches("com.example"));
        assertFalse(pattern.matches("org.example.A"));
    }

    @Test
    @DisplayName("问号匹配单个字符")
    void questionMark() {
        GlobPattern pattern = GlobPattern.compile("plugin?");

        assertTrue(pattern.matches("plugin1"));
        assertFalse(pattern.matches("plugin"));
        assertFalse(pattern.matches("plugin12"));
    }

    @Test
    @DisplayName("字符集与取反字符集")
    void characterClasses() {
        assertTrue(GlobPattern.compile("v[12]").matches("v1"));
        assertFalse(GlobPattern.compile("v[12]").matches("v3"));
        assertTrue(GlobPattern.compile("v[!12]").matches("v3"));
        assertFalse(GlobPattern.compile("v[!12]").matches("v1"));
        assertTrue(GlobPattern.compile("[a-c]x").matches("bx"));
    }

    @Test
    @DisplayName("正则元字符按字面量处理")
    void regexMetaCharactersAreLiteral() {
        assertTrue(GlobPattern.compile("a+b(c)").matches("a+b(c)"));
        assertFalse(GlobPattern.compile("a.b").matches("axb"));
        assertTrue(GlobPattern.compile("[unclosed").matches("[unclosed"));
    }

    @Test
    @DisplayName("null 不匹配任何模式")
    void nullNeverMatches() {
        assertFalse(GlobPattern.compile("*").matches(null));
    }
}
