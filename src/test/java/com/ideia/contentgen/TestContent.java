package com.ideia.contentgen;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ideia.contentgen.model.Curiosity;
import com.ideia.contentgen.model.QuizQuestion;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Hand-written sample content that passes validation and is pairwise dissimilar.
 */
public final class TestContent {
    private TestContent() {}

    public static final ObjectMapper MAPPER = new ObjectMapper();

    public static final List<String> TITLES = List.of(
            "Polvos têm três corações",
            "A Torre Eiffel cresce no verão",
            "Bananas são levemente radioativas",
            "Mel nunca estraga de verdade",
            "Vênus gira ao contrário",
            "Formigas não dormem como nós",
            "O coração da baleia-azul é gigante",
            "Cleópatra viveu mais perto do iPhone que das pirâmides",
            "Tubarões existem antes das árvores",
            "Flamingos nascem cinzentos",
            "Um dia em Mercúrio dura meses",
            "Girafas dormem poucos minutos");

    public static final List<String> QUESTIONS = List.of(
            "Qual planeta é conhecido como planeta vermelho?",
            "Quantos ossos tem o corpo humano adulto?",
            "Em que ano o homem pisou na Lua pela primeira vez?",
            "Qual é o maior oceano da Terra?",
            "Quem pintou a Mona Lisa?",
            "Qual gás as plantas absorvem na fotossíntese?",
            "Que animal terrestre corre mais rápido?",
            "Qual metal líquido aparece nos termômetros antigos?");

    /** Text of exactly {@code n} words that starts with the words of {@code seed}. */
    public static String words(String seed, int n) {
        List<String> out = new ArrayList<>(Arrays.asList(seed.trim().split("\\s+")));
        while (out.size() < n) out.add("detalhe");
        return String.join(" ", out.subList(0, n));
    }

    public static ObjectNode curiosityNode(String title, int contentWords) {
        ObjectNode n = MAPPER.createObjectNode();
        n.put("title", title);
        n.put("hook", "Você sabia?");
        n.put("content", words(title, contentWords));
        n.put("funFact", "Um fato extra sobre " + title);
        n.put("curiosityLevel", 3);
        return n;
    }

    public static ObjectNode curiosityNode(String title) {
        return curiosityNode(title, 50);
    }

    public static ObjectNode quizNode(String question) {
        ObjectNode n = MAPPER.createObjectNode();
        n.put("difficulty", "medium");
        n.put("question", question);
        ArrayNode options = n.putArray("options");
        options.add("Alternativa um");
        options.add("Alternativa dois");
        options.add("Alternativa três");
        options.add("Alternativa quatro");
        n.put("correctAnswer", "Alternativa dois");
        n.put("explanation", "Porque a alternativa dois é a correta.");
        return n;
    }

    public static String curiosityArray(List<String> titles) {
        ArrayNode arr = MAPPER.createArrayNode();
        titles.forEach(t -> arr.add(curiosityNode(t)));
        return arr.toString();
    }

    public static String quizArray(List<String> questions) {
        ArrayNode arr = MAPPER.createArrayNode();
        questions.forEach(q -> arr.add(quizNode(q)));
        return arr.toString();
    }

    public static Curiosity curiosity(String id, String categoryId, String title) {
        Curiosity c = new Curiosity();
        c.setId(id);
        c.setCategoryId(categoryId);
        c.setTitle(title);
        c.setHook("Você sabia?");
        c.setContent(words(title, 50));
        c.setFunFact("Um fato extra sobre " + title);
        c.setCuriosityLevel(2);
        return c;
    }

    public static QuizQuestion quiz(String id, String categoryId, String question) {
        QuizQuestion q = new QuizQuestion();
        q.setId(id);
        q.setCategoryId(categoryId);
        q.setDifficulty("easy");
        q.setQuestion(question);
        q.setOptions(List.of("A", "B", "C", "D"));
        q.setCorrectAnswer("A");
        q.setExplanation("Porque a primeira alternativa é a certa.");
        return q;
    }
}
