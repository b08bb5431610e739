package com.questrail.dtchat.prediction;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * ContactPlanParser
 * -----------------------------------------------------------------------------
 * Reads the subset of the ION contact plan format used for prediction:
 *
 * <pre>
 *   a contact +START +END FROM TO RATE     # rate in bytes/s
 *   a range   +START +END FROM TO OWLT     # one-way light time in seconds
 * </pre>
 *
 * <p>Times are seconds relative to the plan start; the leading {@code +} is
 * optional. Blank lines, {@code #} comments and other commands are ignored.
 * Ranges are symmetric: a range between A and B applies to contacts in both
 * directions whose start falls inside the range interval.</p>
 */
public final class ContactPlanParser
{
    private record Range(String a, String b, double start, double end, double owlt) {
        boolean covers(String from, String to, double at) {
            boolean pair = (a.equals(from) && b.equals(to)) || (a.equals(to) && b.equals(from));
            return pair && at >= start && at < end;
        }
    }

    private record PendingContact(String from, String to, double start, double end, double rate) {
    }

    private ContactPlanParser() {
    }

    public static ContactPlan parse(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parse(reader);
        }
    }

    public static ContactPlan parse(Reader reader) throws IOException {
        Objects.requireNonNull(reader, "reader");

        List<PendingContact> pending = new ArrayList<>();
        List<Range> ranges = new ArrayList<>();
        Set<String> nodes = new LinkedHashSet<>();

        BufferedReader lines = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
        String line;
        int lineNo = 0;
        while ((line = lines.readLine()) != null) {
            lineNo++;
            int hash = line.indexOf('#');
            String content = (hash >= 0 ? line.substring(0, hash) : line).trim();
            if (content.isEmpty()) {
                continue;
            }

            String[] tokens = content.split("\\s+");
            if (tokens.length < 2 || !"a".equals(tokens[0])) {
                continue;
            }

            switch (tokens[1]) {
                case "contact" -> {
                    requireArity(tokens, lineNo, line);
                    PendingContact c = new PendingContact(
                            tokens[4], tokens[5],
                            time(tokens[2], lineNo), time(tokens[3], lineNo),
                            number(tokens[6], lineNo));
                    if (c.end() < c.start() || c.rate() <= 0) {
                        throw new IOException("Line " + lineNo + ": invalid contact '" + line.trim() + "'");
                    }
                    pending.add(c);
                    nodes.add(c.from());
                    nodes.add(c.to());
                }
                case "range" -> {
                    requireArity(tokens, lineNo, line);
                    Range r = new Range(
                            tokens[4], tokens[5],
                            time(tokens[2], lineNo), time(tokens[3], lineNo),
                            number(tokens[6], lineNo));
                    if (r.owlt() < 0) {
                        throw new IOException("Line " + lineNo + ": negative one-way light time");
                    }
                    ranges.add(r);
                }
                default -> {
                    // other ION commands (a node, a plan, ...) carry nothing we route on
                }
            }
        }

        List<Contact> contacts = new ArrayList<>(pending.size());
        for (PendingContact c : pending) {
            double owlt = ranges.stream()
                    .filter(r -> r.covers(c.from(), c.to(), c.start()))
                    .mapToDouble(Range::owlt)
                    .findFirst()
                    .orElse(0.0);
            contacts.add(new Contact(c.from(), c.to(), c.start(), c.end(), c.rate(), owlt));
        }

        return new ContactPlan(nodes, contacts);
    }

    private static void requireArity(String[] tokens, int lineNo, String line) throws IOException {
        if (tokens.length < 7) {
            throw new IOException("Line " + lineNo + ": expected 'a " + tokens[1]
                    + " START END FROM TO VALUE', got '" + line.trim() + "'");
        }
    }

    private static double time(String token, int lineNo) throws IOException {
        return number(token.startsWith("+") ? token.substring(1) : token, lineNo);
    }

    private static double number(String token, int lineNo) throws IOException {
        try {
            double value = Double.parseDouble(token);
            if (!Double.isFinite(value)) {
                throw new IOException("Line " + lineNo + ": not a finite number '" + token + "'");
            }
            return value;
        }
        catch (NumberFormatException e) {
            throw new IOException("Line " + lineNo + ": not a number '" + token + "'", e);
        }
    }
}
