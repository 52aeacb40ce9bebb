package com.ideia.contentgen.service.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.ideia.contentgen.model.ContentKind;
import com.ideia.contentgen.model.Curiosity;
import com.ideia.contentgen.model.QuizQuestion;
import com.ideia.contentgen.util.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural and business-rule acceptance of generated items. Pure: no state, no I/O beyond debug
 * logging of the rejection reason.
 *
 * <h3>Curiosity</h3>
 * <ul>
 *   <li>title: 6 to 120 characters after trim</li>
 *   <li>content: 40 to 90 words, both bounds inclusive</li>
 *   <li>funFact: at least 10 characters after trim</li>
 *   <li>hook (optional): at least 6 characters after trim</li>
 *   <li>curiosityLevel (optional): integer 1 to 5</li>
 * </ul>
 *
 * <h3>Quiz question</h3>
 * <ul>
 *   <li>difficulty: easy, medium or hard</li>
 *   <li>question: at least 10 characters after trim</li>
 *   <li>options: exactly 4 non-blank strings, pairwise distinct after normalization</li>
 *   <li>correctAnswer: normalized-matches exactly one option</li>
 *   <li>explanation: at least 12 characters after trim</li>
 * </ul>
 */
public class ContentValidator {
    private static final Logger log = LoggerFactory.getLogger(ContentValidator.class);

    public static final int TITLE_MIN = 6;
    public static final int TITLE_MAX = 120;
    public static final int CONTENT_MIN_WORDS = 40;
    public static final int CONTENT_MAX_WORDS = 90;
    public static final int FUN_FACT_MIN = 10;
    public static final int HOOK_MIN = 6;
    public static final int QUESTION_MIN = 10;
    public static final int EXPLANATION_MIN = 12;
    public static final int OPTION_COUNT = 4;
    private static final Set<String> DIFFICULTIES = Set.of("easy", "medium", "hard");

    public boolean validate(JsonNode item, ContentKind kind) {
        String reason = kind == ContentKind.QUIZZES ? quizRejection(item) : curiosityRejection(item);
        if (reason != null) {
            log.debug("Rejected {} candidate: {}", kind.getLabel(), reason);
            return false;
        }
        return true;
    }

    String curiosityRejection(JsonNode item) {
        if (item == null || !item.isObject()) return "not an object";
        String title = text(item, "title");
        if (title == null) return "missing title";
        title = title.trim();
        if (title.length() < TITLE_MIN || title.length() > TITLE_MAX) return "title length " + title.length();
        String content = text(item, "content");
        if (content == null) return "missing content";
        int words = TextNormalizer.wordCount(content);
        if (words < CONTENT_MIN_WORDS || words > CONTENT_MAX_WORDS) return "content has " + words + " words";
        String funFact = text(item, "funFact");
        if (funFact == null || funFact.trim().length() < FUN_FACT_MIN) return "funFact too short";

        JsonNode hook = item.get("hook");
        if (hook != null && !hook.isNull()) {
            if (!hook.isTextual() || hook.asText().trim().length() < HOOK_MIN) return "hook too short";
        }
        JsonNode level = item.get("curiosityLevel");
        if (level != null && !level.isNull()) {
            if (!level.isNumber() || !isWhole(level)) return "curiosityLevel not an integer";
            int v = level.asInt();
            if (v < 1 || v > 5) return "curiosityLevel " + v;
        }
        return null;
    }

    String quizRejection(JsonNode item) {
        if (item == null || !item.isObject()) return "not an object";
        String difficulty = text(item, "difficulty");
        if (difficulty == null || !DIFFICULTIES.contains(difficulty)) return "difficulty " + difficulty;

        String question = trimmed(item, "question");
        if (question.length() < QUESTION_MIN) return "question too short";

        JsonNode options = item.get("options");
        if (options == null || !options.isArray() || options.size() != OPTION_COUNT) return "options must have 4 entries";
        List<String> opts = new ArrayList<>();
        for (JsonNode o : options) {
            if (o == null || o.isNull() || o.isContainerNode()) return "non-scalar option";
            String s = o.asText("").trim();
            if (s.isEmpty()) return "blank option";
            opts.add(s);
        }
        Set<String> normalized = new HashSet<>();
        for (String o : opts) normalized.add(TextNormalizer.normalize(o));
        if (normalized.size() != OPTION_COUNT) return "options not distinct";

        String correct = trimmed(item, "correctAnswer");
        if (correct.isEmpty()) return "missing correctAnswer";
        if (matchingOption(opts, correct) == null) return "correctAnswer matches no option";

        String explanation = trimmed(item, "explanation");
        if (explanation.length() < EXPLANATION_MIN) return "explanation too short";
        return null;
    }

    /** Builds a curiosity from a node that passed {@link #validate}. Id and category are left unset. */
    public Curiosity toCuriosity(JsonNode item) {
        Curiosity c = new Curiosity();
        c.setTitle(item.get("title").asText().trim());
        c.setContent(item.get("content").asText().trim());
        c.setFunFact(item.get("funFact").asText().trim());
        JsonNode hook = item.get("hook");
        if (hook != null && hook.isTextual()) c.setHook(hook.asText().trim());
        JsonNode level = item.get("curiosityLevel");
        if (level != null && level.isNumber()) c.setCuriosityLevel(level.asInt());
        return c;
    }

    /**
     * Builds a quiz question from a validated node. The stored correctAnswer is the option text it
     * matched, so clients can compare answers verbatim.
     */
    public QuizQuestion toQuizQuestion(JsonNode item) {
        QuizQuestion q = new QuizQuestion();
        q.setDifficulty(item.get("difficulty").asText());
        q.setQuestion(item.get("question").asText().trim());
        List<String> opts = new ArrayList<>();
        item.get("options").forEach(o -> opts.add(o.asText().trim()));
        q.setOptions(opts);
        q.setCorrectAnswer(matchingOption(opts, item.get("correctAnswer").asText().trim()));
        q.setExplanation(item.get("explanation").asText().trim());
        return q;
    }

    private static String matchingOption(List<String> options, String answer) {
        String target = TextNormalizer.normalize(answer);
        String match = null;
        for (String o : options) {
            if (TextNormalizer.normalize(o).equals(target)) {
                if (match != null) return null;
                match = o;
            }
        }
        return match;
    }

    private static String text(JsonNode item, String field) {
        JsonNode n = item.get(field);
        return n != null && n.isTextual() ? n.asText() : null;
    }

    private static String trimmed(JsonNode item, String field) {
        JsonNode n = item.get(field);
        if (n == null || n.isNull() || n.isContainerNode()) return "";
        return n.asText("").trim();
    }

    private static boolean isWhole(JsonNode n) {
        return n.isIntegralNumber() || n.asDouble() == Math.rint(n.asDouble());
    }
}
