package com.ryuqq.conductor.application.middleware;

import java.util.regex.Pattern;

/**
 * 입력 차단 규칙.
 *
 * @param name 규칙 이름 (BlockedInput 사유로 기록됨)
 * @param pattern 입력에서 찾을 정규식
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SafetyRule(String name, Pattern pattern) {

    public SafetyRule {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (pattern == null) {
            throw new IllegalArgumentException("pattern cannot be null");
        }
    }

    /**
     * 대소문자 구분 없는 규칙 생성.
     *
     * @param name 규칙 이름
     * @param regex 정규식
     * @return SafetyRule
     */
    public static SafetyRule of(String name, String regex) {
        return new SafetyRule(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
    }

    public boolean matches(String text) {
        return pattern.matcher(text).find();
    }
}
