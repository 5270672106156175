package com.example.wheelcodereader.service.postprocess;

/**
 * Context-dependent character rewrite applied by {@link InlineCharacterCorrector}.
 */
public interface CorrectionRule {

    boolean appliesTo(String text);

    String apply(String text);
}
