package com.bbthechange.harambee.service;

import com.bbthechange.harambee.config.SmsVotingProperties;
import com.bbthechange.harambee.model.VoteTally;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Text of every SMS the service sends or returns to a member.
 * Keeps the wording in one place so the OTP, broadcast and webhook replies stay consistent.
 */
@Component
public class SmsTextGenerator {

    private static final DateTimeFormatter DEADLINE_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneOffset.UTC);

    private final SmsVotingProperties properties;

    public SmsTextGenerator(SmsVotingProperties properties) {
        this.properties = properties;
    }

    /**
     * Generate the OTP delivery message.
     * @param code the one-time code
     * @param validMinutes minutes until the code expires
     */
    public String getOtpMessage(String code, long validMinutes) {
        return String.format(Locale.ROOT, "Your Harambee DAO verification code is: %s. Valid for %d minutes. Do not share this code.",
                code, validMinutes);
    }

    /**
     * Generate the broadcast announcing that a proposal is open for SMS voting.
     */
    public String getVotingBroadcast(String title, Instant votingDeadline, String shortCode) {
        return "🗳️ HARAMBEE DAO VOTE\n"
                + "Proposal: " + truncate(title, properties.getBroadcastTitleLength()) + "\n"
                + "Vote by " + DEADLINE_FORMAT.format(votingDeadline) + "\n"
                + "Reply: YES" + shortCode + " or NO" + shortCode + "\n"
                + "Example: YES" + shortCode;
    }

    public String getVoteConfirmation(boolean inFavour, String title, VoteTally tally) {
        return String.format(Locale.ROOT, "✅ Vote recorded: %s for %s...\nCurrent tally: %d YES, %d NO",
                inFavour ? "YES" : "NO",
                truncate(title, properties.getConfirmationTitleLength()),
                tally.yes(), tally.no());
    }

    public String getUnregisteredPhone() {
        return "❌ Phone number not registered. Please register first at " + properties.getRegistrationUrl();
    }

    public String getUnverifiedPhone() {
        return "❌ Phone number not verified. Please complete verification first.";
    }

    public String getInvalidFormat() {
        return "❌ Invalid vote format. Use YES### or NO### (e.g., YES001)";
    }

    public String getInvalidProposalCode(String shortCode) {
        return "❌ Invalid proposal code: " + shortCode;
    }

    public String getDeadlinePassed(String shortCode) {
        return "❌ Voting deadline passed for proposal " + shortCode;
    }

    public String getAlreadyVoted(String shortCode) {
        return "❌ You already voted on proposal " + shortCode;
    }

    public String getVoteError() {
        return "❌ Error recording vote. Please try again.";
    }

    private static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.codePointCount(0, text.length()) <= maxLength) {
            return text;
        }
        // Cut on a code point boundary so emoji are never split
        return text.substring(0, text.offsetByCodePoints(0, maxLength));
    }
}
