package com.ideia.contentgen.model;

import java.util.ArrayList;
import java.util.List;

public class HashIndexSnapshot {
    private String updatedAt;
    private List<String> titles = new ArrayList<>();
    private List<String> contents = new ArrayList<>();
    private List<String> questions = new ArrayList<>();

    public String getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(String updatedAt) {
        this.updatedAt = updatedAt;
    }

    public List<String> getTitles() {
        return titles;
    }

    public void setTitles(List<String> titles) {
        this.titles = titles;
    }

    public List<String> getContents() {
        return contents;
    }

    public void setContents(List<String> contents) {
        this.contents = contents;
    }

    public List<String> getQuestions() {
        return questions;
    }

    public void setQuestions(List<String> questions) {
        this.questions = questions;
    }
}
