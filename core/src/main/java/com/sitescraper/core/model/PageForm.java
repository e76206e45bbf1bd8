package com.sitescraper.core.model;

import java.util.List;
import java.util.Locale;

/**
 * 페이지 안의 form 하나. action 은 속성 원문(없으면 ""), method 는 대문자(기본 GET).
 */
public record PageForm(String action, String method, List<Input> inputs) {

    public PageForm {
        action = (action == null) ? "" : action;
        method = (method == null || method.isBlank()) ? "GET" : method.trim().toUpperCase(Locale.ROOT);
        inputs = (inputs == null) ? List.of() : List.copyOf(inputs);
    }

    /** input/textarea/select 하나. type 기본값 "text", label 은 label[for] 또는 감싼 label 의 텍스트 */
    public record Input(String type, String name, String placeholder, String label) {
        public Input {
            type = (type == null || type.isBlank()) ? "text" : type.trim().toLowerCase(Locale.ROOT);
            name = (name == null) ? "" : name;
            placeholder = (placeholder == null) ? "" : placeholder;
            label = (label == null) ? "" : label;
        }
    }

    /** 표 셀용 요약: "POST /login (3 inputs)" */
    public String summary() {
        return method + " " + (action.isEmpty() ? "-" : action) + " (" + inputs.size() + " inputs)";
    }
}
