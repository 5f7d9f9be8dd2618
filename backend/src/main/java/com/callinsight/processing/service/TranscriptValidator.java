package com.callinsight.processing.service;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

@Component
public class TranscriptValidator {

    static final int MIN_CHARACTERS = 20;
    static final int MIN_WORDS = 5;
    private static final int CONVERSATIONAL_WORD_THRESHOLD = 15;

    private static final Pattern SPEAKER_LABEL = Pattern.compile("\\[SPEAKER_\\d+]:");
    private static final Pattern BRACKETED = Pattern.compile("\\[.*?]");
    private static final Pattern HAS_LETTER = Pattern.compile("[a-zA-Z]");

    private static final List<Pattern> NOISE_PATTERNS = List.of(
            Pattern.compile("^[\\s.,!?\\-]+$"),
            Pattern.compile("^(ring|ringing|beep|tone|music|silence|noise|static|hum|buzz|click)+[\\s,.]*$"),
            Pattern.compile("^(uh|um|hmm|ah|oh|eh|er)+[\\s,.]*$"),
            Pattern.compile("^(hello|hi|hey|bye|goodbye|thank you|thanks|okay|ok|yes|no|yeah|yep|nope)[\\s,.!?]*$")
    );

    private static final List<Pattern> CONVERSATIONAL_MARKERS = List.of(
            Pattern.compile("\\b(what|how|when|where|why|who|can|could|would|should|is|are|do|does|have|has)\\b"),
            Pattern.compile("\\b(please|need|want|help|service|visa|id|company|license|document|appointment)\\b"),
            Pattern.compile("\\b(yes|no|okay|sure|right|correct|exactly|understand)\\b"),
            Pattern.compile("\\b(sir|madam|mam|mr|mrs|miss)\\b"),
            Pattern.compile("\\b(call|calling|phone|number|contact|reach)\\b"),
            Pattern.compile("\\b(thank|thanks|welcome|sorry|excuse)\\b")
    );

    public ValidationResult validate(String transcript) {
        if (transcript == null || transcript.isBlank()) {
            return ValidationResult.rejected("Empty transcript");
        }
        String cleaned = transcript.strip();
        if (cleaned.length() < MIN_CHARACTERS) {
            return ValidationResult.rejected("Transcript too short");
        }

        String textOnly = BRACKETED.matcher(SPEAKER_LABEL.matcher(cleaned).replaceAll("")).replaceAll("").strip();
        List<String> words = new ArrayList<>();
        for (String token : textOnly.split("\\s+")) {
            if (token.length() >= 2 && HAS_LETTER.matcher(token).find()) {
                words.add(token);
            }
        }
        if (words.size() < MIN_WORDS) {
            return ValidationResult.rejected("Insufficient content (" + words.size() + " words)");
        }

        String lower = textOnly.toLowerCase(Locale.ROOT);
        for (Pattern noise : NOISE_PATTERNS) {
            if (noise.matcher(lower).matches()) {
                return ValidationResult.rejected("Transcript contains only noise or minimal interaction");
            }
        }

        Set<String> distinct = new HashSet<>();
        for (String word : words) {
            if (word.length() >= 3) {
                distinct.add(word.toLowerCase(Locale.ROOT));
            }
        }
        if (distinct.size() < 3) {
            return ValidationResult.rejected("Transcript contains repetitive non-conversational content");
        }

        boolean conversational = CONVERSATIONAL_MARKERS.stream().anyMatch(marker -> marker.matcher(lower).find());
        if (!conversational && words.size() < CONVERSATIONAL_WORD_THRESHOLD) {
            return ValidationResult.rejected("Transcript lacks conversational content");
        }
        return ValidationResult.ACCEPTED;
    }

    public record ValidationResult(boolean valid, String reason) {

        static final ValidationResult ACCEPTED = new ValidationResult(true, "Valid transcript");

        static ValidationResult rejected(String reason) {
            return new ValidationResult(false, reason);
        }
    }
}
