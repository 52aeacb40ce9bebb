package com.ideia.contentgen.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "categoryId", "title", "hook", "content", "funFact", "curiosityLevel"})
public class Curiosity implements ContentItem {
    private String id;
    private String categoryId;
    private String title;
    private String hook; // optional teaser line
    private String content;
    private String funFact;
    private Integer curiosityLevel; // 1 = common, 5 = ultra rare

    @Override
    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    @Override
    public String getCategoryId() {
        return categoryId;
    }

    public void setCategoryId(String categoryId) {
        this.categoryId = categoryId;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getHook() {
        return hook;
    }

    public void setHook(String hook) {
        this.hook = hook;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public String getFunFact() {
        return funFact;
    }

    public void setFunFact(String funFact) {
        this.funFact = funFact;
    }

    public Integer getCuriosityLevel() {
        return curiosityLevel;
    }

    public void setCuriosityLevel(Integer curiosityLevel) {
        this.curiosityLevel = curiosityLevel;
    }

    @Override
    public String dedupKey() {
        return title;
    }
}
