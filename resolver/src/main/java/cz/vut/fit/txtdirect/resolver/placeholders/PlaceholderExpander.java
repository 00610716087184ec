package cz.vut.fit.txtdirect.resolver.placeholders;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.net.UrlEscapers;
import cz.vut.fit.txtdirect.http.RedirectRequest;
import cz.vut.fit.txtdirect.models.ResolutionContext;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Set;

/**
 * Replaces {@code {token}} placeholders in directive values with parts of the current request.
 * <p>
 * Supported tokens: {@code uri}, {@code uri_escaped}, {@code path}, {@code path_escaped}, {@code dir},
 * {@code file}, {@code query}, {@code query_escaped}, {@code fragment}, {@code host}, {@code hostonly},
 * {@code port}, {@code method}, {@code scheme}, {@code remote}, {@code remainder}, {@code labelN},
 * {@code >Header}, {@code ?queryKey}, {@code ~cookie} and {@code N} (path captures). Unknown tokens and
 * unterminated braces are kept as they are.
 */
public class PlaceholderExpander {
    private static final String LABEL_PREFIX = "label";

    @NotNull
    public String expand(@NotNull String template, @NotNull RedirectRequest request) {
        return expand(template, request, null, Set.of());
    }

    @NotNull
    public String expand(@NotNull String template, @NotNull RedirectRequest request,
                         @Nullable ResolutionContext context) {
        return expand(template, request, context, Set.of());
    }

    /**
     * Expands the placeholders in a template.
     *
     * @param template   the text to expand
     * @param request    the request supplying the values
     * @param context    the resolution context supplying path captures; may be null
     * @param exclusions token names (without braces) that are left unexpanded
     * @return the expanded text
     */
    @NotNull
    public String expand(@NotNull String template, @NotNull RedirectRequest request,
                         @Nullable ResolutionContext context, @NotNull Set<String> exclusions) {
        if (template.indexOf('{') < 0)
            return template;

        final var result = new StringBuilder(template.length() + 32);
        var position = 0;
        while (position < template.length()) {
            final var open = template.indexOf('{', position);
            if (open < 0) {
                result.append(template, position, template.length());
                break;
            }

            final var close = template.indexOf('}', open + 1);
            if (close < 0) {
                result.append(template, position, template.length());
                break;
            }

            result.append(template, position, open);
            final var token = template.substring(open + 1, close);
            final var value = exclusions.contains(token) ? null : resolve(token, request, context);
            if (value == null) {
                result.append(template, open, close + 1);
            } else {
                result.append(value);
            }
            position = close + 1;
        }

        return result.toString();
    }

    /**
     * The value of a single token, or null if the token is not known.
     */
    @Nullable
    protected String resolve(@NotNull String token, @NotNull RedirectRequest request,
                             @Nullable ResolutionContext context) {
        if (token.isEmpty())
            return null;

        final var fixed = switch (token.charAt(0)) {
            case '>' -> Strings.nullToEmpty(request.header(token.substring(1)));
            case '?' -> Strings.nullToEmpty(request.queryParameter(token.substring(1)));
            case '~' -> Strings.nullToEmpty(request.cookie(token.substring(1)));
            default -> switch (token) {
                case "uri" -> request.uri();
                case "uri_escaped" -> escape(request.uri());
                case "path" -> request.path();
                case "path_escaped" -> escape(request.path());
                case "dir" -> request.path().substring(0, request.path().lastIndexOf('/') + 1);
                case "file" -> request.path().substring(request.path().lastIndexOf('/') + 1);
                case "query" -> request.query();
                case "query_escaped" -> escape(request.query());
                // Fragments are never sent to the server
                case "fragment" -> "";
                case "host" -> request.host();
                case "hostonly" -> request.hostOnly();
                case "port" -> request.port();
                case "method" -> request.method();
                case "scheme" -> request.scheme();
                case "remote" -> request.remoteAddress();
                case "remainder" -> context == null ? "" : context.pathRemainder();
                default -> null;
            };
        };

        if (fixed != null)
            return fixed;

        if (token.startsWith(LABEL_PREFIX)) {
            final var index = parseIndex(token.substring(LABEL_PREFIX.length()));
            if (index < 1)
                return null;

            final var labels = Splitter.on('.').splitToList(request.hostOnly());
            return index <= labels.size() ? labels.get(index - 1) : "";
        }

        final var captureIndex = parseIndex(token);
        if (captureIndex >= 1) {
            if (context == null)
                return "";

            final var captures = context.pathCaptures();
            return captureIndex <= captures.size() ? captures.get(captureIndex - 1) : "";
        }

        return null;
    }

    private static int parseIndex(String value) {
        if (value.isEmpty() || value.length() > 4)
            return -1;

        for (var i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i)))
                return -1;
        }
        return Integer.parseInt(value);
    }

    private static String escape(String value) {
        return UrlEscapers.urlFormParameterEscaper().escape(value);
    }
}
