package com.rice.recommender.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TextUtilsTest {

    @Test
    public void simplifyLowercasesAndStripsPunctuation() {
        assertEquals("give me asian chicken please", TextUtils.simplify("Give me Asian chicken, please!!"));
    }

    @Test
    public void simplifyTreatsHyphensAndApostrophesAsSeparators() {
        assertEquals("main dish", TextUtils.simplify("Main-Dish"));
        assertEquals("i d like", TextUtils.simplify("I'd like"));
    }

    @Test
    public void simplifyHandlesNullAndNbsp() {
        assertEquals("", TextUtils.simplify(null));
        assertEquals("quick vegan", TextUtils.simplify("quick vegan"));
    }

    @Test
    public void sanitizeTitleStripsSeparatorsAndCollapsesSpaces() {
        assertEquals("Sesame Chicken", TextUtils.sanitizeTitle(" —  |  Sesame   Chicken  — "));
        assertEquals("Chili – Texas Style", TextUtils.sanitizeTitle("Chili  –  Texas Style"));
    }

    @Test
    public void sanitizeTitleFallsBackToTrimmedOriginal() {
        assertEquals("—", TextUtils.sanitizeTitle("   —  "));
    }

    @Test
    public void titleCaseCapitalizesWords() {
        assertEquals("Easy Chicken Stir-Fry", TextUtils.titleCase("easy CHICKEN stir-fry"));
        assertEquals("Mom's 3rd Pie", TextUtils.titleCase("mom's 3rd pie"));
    }

    @Test
    public void abbreviateCutsLongInput() {
        assertEquals("abc...", TextUtils.abbreviate("abcdef", 3));
        assertEquals("abc", TextUtils.abbreviate("abc", 3));
        assertEquals("", TextUtils.abbreviate(null, 3));
    }
}
