package com.ideia.contentgen.service.generation;

import com.ideia.contentgen.model.Category;
import com.ideia.contentgen.model.ContentKind;

import java.util.List;

/**
 * Prompts for the generator, in Portuguese like the content itself. The most recent titles or
 * questions of the category are listed as off-limits.
 */
public class PromptBuilder {
    public static final int BANNED_LIMIT = 200;

    public String build(ContentKind kind, Category category, int count, List<String> existingTexts) {
        String banned = String.join(" ; ", tail(existingTexts, BANNED_LIMIT));
        return kind == ContentKind.QUIZZES
                ? quizPrompt(category.getName(), count, banned)
                : curiosityPrompt(category.getName(), count, banned);
    }

    private String curiosityPrompt(String categoryName, int count, String banned) {
        return String.format("""
                Crie %d curiosidades INÉDITAS e cativantes sobre o tema "%s".
                Responda com um ARRAY JSON de objetos com os campos:
                - "title": título curto e instigante (6 a 120 caracteres).
                - "hook": frase de impacto (a partir de 6 caracteres), como "Você sabia que..." ou "Incrível:".
                - "content": um parágrafo de 40 a 90 palavras, linguagem simples.
                - "funFact": um fato extra surpreendente (obrigatório, pelo menos 10 caracteres).
                - "curiosityLevel": inteiro de 1 (comum) a 5 (ultra-raro).
                Regras:
                - Não repita, reescreva nem reordene estes títulos já publicados: %s
                - Prefira fatos pouco conhecidos, histórias curtas e surpresa genuína.
                - Varie o vocabulário e o início das frases.
                Devolva SOMENTE o array JSON.
                """, count, categoryName, banned.isEmpty() ? "(nenhum)" : banned);
    }

    private String quizPrompt(String categoryName, int count, String banned) {
        return String.format("""
                Crie %d perguntas de quiz originais sobre "%s".
                Responda com um ARRAY JSON de objetos com os campos:
                - "difficulty": "easy", "medium" ou "hard".
                - "question": pergunta curta e clara (pelo menos 10 caracteres).
                - "options": exatamente 4 alternativas plausíveis e diferentes entre si.
                - "correctAnswer": cópia exata de uma das alternativas.
                - "explanation": por que a resposta certa está certa e as outras erradas, com uma curiosidade extra.
                Regras:
                - Não repita estas perguntas já publicadas: %s
                - Misture dificuldades e estilos.
                - Evite datas ou valores duvidosos.
                Devolva SOMENTE o array JSON.
                """, count, categoryName, banned.isEmpty() ? "(nenhuma)" : banned);
    }

    static List<String> tail(List<String> texts, int limit) {
        if (texts == null || texts.isEmpty()) return List.of();
        return texts.subList(Math.max(0, texts.size() - limit), texts.size());
    }
}
