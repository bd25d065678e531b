package com.bbthechange.harambee.service;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses vote replies of the form {@code YES007} or {@code NO1234}.
 * Case and surrounding whitespace are ignored; anything else is not a vote.
 */
@Component
public class VoteMessageParser {

    private static final Pattern VOTE_PATTERN = Pattern.compile("^(YES|NO)(\\d{3,4})$");

    public Optional<ParsedVote> parse(String message) {
        if (message == null) {
            return Optional.empty();
        }
        Matcher matcher = VOTE_PATTERN.matcher(message.trim().toUpperCase(Locale.ROOT));
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new ParsedVote("YES".equals(matcher.group(1)), matcher.group(2)));
    }

    public record ParsedVote(boolean inFavour, String shortCode) {
    }
}
