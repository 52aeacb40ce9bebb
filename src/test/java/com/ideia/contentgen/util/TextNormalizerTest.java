package com.ideia.contentgen.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TextNormalizerTest {

    @Test
    public void lowercasesStripsDiacriticsAndPunctuation() {
        assertEquals("voce sabia que o coracao bate", TextNormalizer.normalize("  Você SABIA que... o coração   bate?! "));
    }

    @Test
    public void keepsDigitsAndCollapsesWhitespace() {
        assertEquals("apollo 11 pousou em 1969", TextNormalizer.normalize("Apollo-11\tpousou\n em 1969."));
    }

    @Test
    public void nullAndSymbolsOnlyNormalizeToEmpty() {
        assertEquals("", TextNormalizer.normalize(null));
        assertEquals("", TextNormalizer.normalize(" —!?… "));
        assertNull(TextNormalizer.fingerprintOf("...!"));
    }

    @Test
    public void fingerprintIsFortyHexCharsAndStable() {
        String fp = TextNormalizer.fingerprint("polvos tem tres coracoes");
        assertEquals(40, fp.length());
        assertTrue(fp.matches("[0-9a-f]{40}"));
        assertEquals(fp, TextNormalizer.fingerprintOf("Polvos têm TRÊS corações!"));
    }

    @Test
    public void knownSha1Value() {
        assertEquals("a9993e364706816aba3e25717850c26c9cd0d89d", TextNormalizer.fingerprint("abc"));
    }

    @Test
    public void wordCountSplitsOnAnyWhitespace() {
        assertEquals(0, TextNormalizer.wordCount("   "));
        assertEquals(4, TextNormalizer.wordCount(" um  dois\ttres\nquatro "));
    }
}
