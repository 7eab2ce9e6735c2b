package com.example.DmOracle.prompt;

/**
 * Prompt templates for every model call the oracle makes.
 */
public final class OraclePrompts {

    private OraclePrompts() {
    }

    private static final String ROUTING = """
            You are an expert query routing assistant for a Dungeons & Dragons knowledge base.
            Classify the user's question into one of two categories based on its intent: 'structured' or 'unstructured'.

            'structured' questions ask for specific, factual data about game entities, such as monster statistics.
            They often involve numbers, lists, comparisons, or filtering. Examples:
            - "What is a Beholder's armor class?"
            - "List all monsters with resistance to cold damage."
            - "Which dragon has more hit points, an adult red or an adult black?"
            - "Show me all CR 5 monsters."

            'unstructured' questions ask about rules, lore, spell descriptions, or ask for creative content.
            They are explanatory or generative in nature. Examples:
            - "How does the grappling condition work?"
            - "What is the history of the elves in the Forgotten Realms?"
            - "Explain how spell slots work in D&D 5e."

            Output only the single word 'structured' or 'unstructured' and nothing else.

            User Question: %s
            Classification:""";

    private static final String SQL_GENERATION = """
            You are a SQL expert for D&D monster data.

            Table: %1$s
            - name (STRING, REQUIRED): Monster name
            - type (STRING): Creature type (Dragon, Beast, Humanoid, etc.)
            - size (STRING): Size category (Tiny, Small, Medium, Large, Huge, Gargantuan)
            - armor_class (INTEGER): Armor Class (AC)
            - hit_points (INTEGER): Hit points
            - speed (STRING): Movement speeds (walk, fly, swim, etc.)
            - challenge_rating (STRING): Challenge Rating as text, e.g. '1/4', '17'
            - abilities (STRING): Ability scores formatted as text (STR, DEX, CON, INT, WIS, CHA)
            - skills (STRING): Proficient skills and bonuses
            - damage_resistances (STRING): Damage types the monster resists
            - damage_immunities (STRING): Damage types the monster is immune to
            - condition_immunities (STRING): Conditions the monster is immune to
            - senses (STRING): Special senses (darkvision, blindsight, etc.)
            - languages (STRING): Languages the monster can speak or understand
            - special_abilities (STRING): Special traits or abilities
            - actions (STRING): Actions the monster can take
            - legendary_actions (STRING): Legendary actions, if any
            - source (STRING): Source book

            Rules:
            - Write exactly one read-only SELECT statement against %1$s and nothing else.
            - challenge_rating is text, not a number: compare it with LIKE or string equality.
            - Use case-insensitive LIKE matching (LOWER(column) LIKE '%%term%%') for names and text columns.
            %2$s
            User Question: %3$s
            SQL query:""";

    private static final String SQL_CORRECTION = """
            - Your previous query failed. Do not repeat the mistake.
              Previous query: %s
              Error: %s
            """;

    private static final String STRUCTURED_ANSWER = """
            You are a helpful Dungeon Master assistant with access to D&D monster data.

            The user asked: "%s"

            Database results:
            %s

            Provide a clear, helpful answer based on this data:""";

    private static final String UNSTRUCTURED_ANSWER = """
            You are a master Dungeon Master, an expert in D&D 5th Edition.

            The user asked: "%s"

            Relevant D&D information:
            %s

            Provide a comprehensive and engaging answer:""";

    private static final String NARRATION = """
            You are a master Dungeon Master and expert storyteller.
            Your tone is %s, engaging, and immersive.

            Create narrative content for: "%s"

            Use vivid descriptions and sensory details. Keep it suitable for D&D games.

            Narrative:""";

    public static String routing(String question) {
        return ROUTING.formatted(question);
    }

    public static String sqlGeneration(String table, String question) {
        return SQL_GENERATION.formatted(table, "", question);
    }

    /**
     * Retry prompt that feeds the failed query and its error back to the model.
     */
    public static String sqlCorrection(String table, String question, String previousQuery, String error) {
        String feedback = SQL_CORRECTION.formatted(
                previousQuery == null || previousQuery.isBlank() ? "(empty)" : previousQuery,
                error);
        return SQL_GENERATION.formatted(table, feedback, question);
    }

    public static String structuredAnswer(String question, String data) {
        return STRUCTURED_ANSWER.formatted(question, data);
    }

    public static String unstructuredAnswer(String question, String documents) {
        return UNSTRUCTURED_ANSWER.formatted(question, documents);
    }

    public static String narration(String prompt, String tone) {
        return NARRATION.formatted(tone, prompt);
    }
}
