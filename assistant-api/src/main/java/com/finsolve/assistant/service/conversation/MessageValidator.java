package com.finsolve.assistant.service.conversation;

import com.finsolve.assistant.config.RagProperties;
import com.finsolve.assistant.exception.MessageValidationException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Rejects empty, oversized or suspicious messages and normalizes the rest before
 * they enter the pipeline.
 */
@Component
public class MessageValidator {

    private static final Pattern CONTROL_CHARACTERS = Pattern.compile("[\\p{Cntrl}&&[^\\r\\n\\t]]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final List<Pattern> INJECTION_PATTERNS = List.of(
            Pattern.compile("(\\bDROP\\b|\\bDELETE\\b|\\bINSERT\\b|\\bUPDATE\\b).*\\bTABLE\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile(";\\s*(DROP|DELETE|INSERT|UPDATE)\\b", Pattern.CASE_INSENSITIVE)
    );
    private static final double MAX_SPECIAL_CHARACTER_RATIO = 0.3;

    private final RagProperties properties;

    public MessageValidator(RagProperties properties) {
        this.properties = properties;
    }

    /**
     * Returns the sanitized message.
     *
     * @throws MessageValidationException if the message is rejected
     */
    public String validate(String message) {
        if (message == null || message.isBlank()) {
            throw new MessageValidationException("Message cannot be empty");
        }
        String sanitized = sanitize(message);
        if (sanitized.isEmpty()) {
            throw new MessageValidationException("Message cannot be empty");
        }
        int maxLength = properties.getMaxMessageLength();
        if (sanitized.length() > maxLength) {
            throw new MessageValidationException("Message too long (max " + maxLength + " characters)");
        }
        for (Pattern pattern : INJECTION_PATTERNS) {
            if (pattern.matcher(sanitized).find()) {
                throw new MessageValidationException("Message contains potentially harmful content");
            }
        }
        if (specialCharacterRatio(sanitized) > MAX_SPECIAL_CHARACTER_RATIO) {
            throw new MessageValidationException("Message contains too many special characters");
        }
        return sanitized;
    }

    String sanitize(String message) {
        String withoutControls = CONTROL_CHARACTERS.matcher(message).replaceAll("");
        return WHITESPACE.matcher(withoutControls).replaceAll(" ").trim();
    }

    private double specialCharacterRatio(String text) {
        long special = text.chars()
                .filter(ch -> !Character.isLetterOrDigit(ch) && !Character.isWhitespace(ch))
                .count();
        return (double) special / text.length();
    }
}
