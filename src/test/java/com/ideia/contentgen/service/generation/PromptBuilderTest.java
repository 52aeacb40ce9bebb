package com.ideia.contentgen.service.generation;

import com.ideia.contentgen.model.Category;
import com.ideia.contentgen.model.ContentKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PromptBuilderTest {

    private final PromptBuilder builder = new PromptBuilder();
    private final Category category = new Category("astronomia", "Astronomia");

    @Test
    public void curiosityPromptNamesCountAndCategory() {
        String prompt = builder.build(ContentKind.CURIOSITIES, category, 12, List.of());
        assertTrue(prompt.contains("Crie 12 curiosidades"));
        assertTrue(prompt.contains("\"Astronomia\""));
        assertTrue(prompt.contains("(nenhum)"));
    }

    @Test
    public void quizPromptListsExistingQuestions() {
        String prompt = builder.build(ContentKind.QUIZZES, category, 3,
                List.of("Qual planeta é conhecido como planeta vermelho?"));
        assertTrue(prompt.contains("Crie 3 perguntas"));
        assertTrue(prompt.contains("Qual planeta é conhecido como planeta vermelho?"));
    }

    @Test
    public void onlyTheMostRecentTextsAreBanned() {
        List<String> existing = new ArrayList<>();
        for (int i = 1; i <= 250; i++) existing.add("titulo-" + i);

        List<String> banned = PromptBuilder.tail(existing, PromptBuilder.BANNED_LIMIT);
        assertEquals(200, banned.size());
        assertEquals("titulo-51", banned.get(0));
        assertEquals("titulo-250", banned.get(199));

        String prompt = builder.build(ContentKind.CURIOSITIES, category, 5, existing);
        assertFalse(prompt.contains("titulo-50 "));
        assertTrue(prompt.contains("titulo-250"));
    }
}
