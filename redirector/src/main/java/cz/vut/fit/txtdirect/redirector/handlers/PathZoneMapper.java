package cz.vut.fit.txtdirect.redirector.handlers;

import com.google.common.base.Splitter;
import cz.vut.fit.txtdirect.exceptions.TypeHandlerException;
import cz.vut.fit.txtdirect.models.FallbackMode;
import cz.vut.fit.txtdirect.models.RedirectRecord;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Maps the path of a request to the sub-zone that holds the record for it.
 * <p>
 * Without {@code from=} or {@code re=}, the first path segment becomes the label in front of the host.
 * A {@code from=} template such as {@code /$2/$1} consumes one path segment per token; {@code $1} is the label
 * next to the host. With {@code re=}, the capture groups of the first match become the labels, group 1 next to
 * the host, and whatever follows the match is the remainder.
 */
public class PathZoneMapper {
    private static final Pattern FROM_TOKEN = Pattern.compile("\\$(\\d+)");

    /**
     * The result of mapping a path.
     *
     * @param captures  The labels in capture order; the first one is adjacent to the host.
     * @param remainder The part of the path that was not consumed, starting with {@code /} unless empty.
     */
    public record PathMapping(@NotNull List<String> captures, @NotNull String remainder) {
        /**
         * The name of the sub-zone of a host.
         */
        @NotNull
        public String zone(@NotNull String host) {
            final var builder = new StringBuilder();
            for (var i = captures.size() - 1; i >= 0; i--) {
                builder.append(captures.get(i)).append('.');
            }
            return builder.append(host).toString();
        }
    }

    @NotNull
    public PathMapping map(@NotNull String path, @NotNull RedirectRecord record) throws TypeHandlerException {
        if (!record.re().isEmpty())
            return mapRegex(path, record);

        final var segments = Splitter.on('/').omitEmptyStrings().splitToList(path);
        if (!record.from().isEmpty())
            return mapTemplate(segments, record);

        if (segments.isEmpty())
            throw error("path has no segment to map", record);

        return new PathMapping(List.of(segments.get(0)), remainder(segments, 1));
    }

    private static PathMapping mapTemplate(List<String> segments, RedirectRecord record) throws TypeHandlerException {
        final var tokens = Splitter.on('/').omitEmptyStrings().splitToList(record.from());
        if (segments.size() < tokens.size())
            throw error("path has fewer segments than from= expects", record);

        final var captures = new String[tokens.size()];
        for (var i = 0; i < tokens.size(); i++) {
            final var matcher = FROM_TOKEN.matcher(tokens.get(i));
            if (!matcher.matches())
                throw error("invalid from= token " + tokens.get(i), record);

            final var position = Integer.parseInt(matcher.group(1));
            if (position < 1 || position > tokens.size() || captures[position - 1] != null)
                throw error("invalid from= position $" + position, record);

            captures[position - 1] = segments.get(i);
        }

        return new PathMapping(Arrays.asList(captures), remainder(segments, tokens.size()));
    }

    private static PathMapping mapRegex(String path, RedirectRecord record) throws TypeHandlerException {
        final Pattern pattern;
        try {
            pattern = Pattern.compile(record.re());
        } catch (PatternSyntaxException e) {
            throw new TypeHandlerException("invalid re= expression: " + e.getDescription(), e,
                    FallbackMode.TO, record.code());
        }

        final var matcher = pattern.matcher(path);
        if (!matcher.find())
            throw error("re= does not match the path", record);

        final var captures = new ArrayList<String>();
        if (matcher.groupCount() == 0) {
            captures.add(matcher.group());
        } else {
            for (var group = 1; group <= matcher.groupCount(); group++) {
                final var value = matcher.group(group);
                if (value == null || value.isEmpty())
                    throw error("re= group " + group + " did not capture anything", record);
                captures.add(value);
            }
        }

        if (captures.get(0).isEmpty())
            throw error("re= matched an empty string", record);

        return new PathMapping(captures, path.substring(matcher.end()));
    }

    private static String remainder(List<String> segments, int consumed) {
        if (consumed >= segments.size())
            return "";
        return "/" + String.join("/", segments.subList(consumed, segments.size()));
    }

    private static TypeHandlerException error(String message, RedirectRecord record) {
        return new TypeHandlerException(message, FallbackMode.TO, record.code());
    }
}
