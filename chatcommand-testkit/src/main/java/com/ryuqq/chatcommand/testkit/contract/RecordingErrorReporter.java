package com.ryuqq.chatcommand.testkit.contract;

import com.ryuqq.chatcommand.core.context.CommandContext;
import com.ryuqq.chatcommand.core.exception.CommandException;
import com.ryuqq.chatcommand.core.spi.ErrorReporter;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link ErrorReporter} that records every report for later assertions.
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public final class RecordingErrorReporter implements ErrorReporter {

    private final List<Report> reports = new CopyOnWriteArrayList<>();

    @Override
    public void report(CommandContext context, CommandException error) {
        reports.add(new Report(context, error));
    }

    public List<Report> reports() {
        return List.copyOf(reports);
    }

    public int count() {
        return reports.size();
    }

    /**
     * Most recent error.
     *
     * @return last reported error
     * @throws IllegalStateException if nothing was reported
     */
    public CommandException lastError() {
        if (reports.isEmpty()) {
            throw new IllegalStateException("No error has been reported");
        }
        return reports.get(reports.size() - 1).error();
    }

    public void clear() {
        reports.clear();
    }

    /**
     * One reported failure.
     *
     * @param context failed invocation
     * @param error reported error
     */
    public record Report(CommandContext context, CommandException error) {
    }
}
