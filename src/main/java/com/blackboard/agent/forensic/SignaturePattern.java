package com.blackboard.agent.forensic;

import com.blackboard.contract.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A known antipattern: a case-insensitive, multi-line regex plus the severity a hit carries.
 *
 * Scans stop with a {@link CancellationException} once the scanning thread is
 * interrupted, so a timed-out agent gives its worker back between matches.
 */
public record SignaturePattern(String tag, Pattern regex, String description, Severity severity) {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.MULTILINE | Pattern.DOTALL;

    public static SignaturePattern of(String tag, String regex, String description, Severity severity) {
        return new SignaturePattern(tag, Pattern.compile(regex, FLAGS), description, severity);
    }

    public int occurrences(String source) {
        checkInterrupted();
        Matcher matcher = regex.matcher(source);
        int count = 0;
        while (matcher.find()) {
            checkInterrupted();
            count++;
        }
        return count;
    }

    public List<String> samples(String source, int limit) {
        Matcher matcher = regex.matcher(source);
        List<String> samples = new ArrayList<>();
        while (samples.size() < limit && matcher.find()) {
            checkInterrupted();
            samples.add(matcher.group());
        }
        return samples;
    }

    private void checkInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("scan for " + tag + " interrupted");
        }
    }
}
