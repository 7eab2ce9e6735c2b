package com.example.DmOracle.llm;

/**
 * "Generate text from prompt" capability.
 *
 * Every call may fail independently with a
 * {@link com.example.DmOracle.exception.LanguageModelException}.
 */
@FunctionalInterface
public interface LanguageModelClient {

    String generate(String prompt);
}
