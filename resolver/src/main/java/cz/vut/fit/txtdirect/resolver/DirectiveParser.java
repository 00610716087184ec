package cz.vut.fit.txtdirect.resolver;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import cz.vut.fit.txtdirect.TxtDirectConfig;
import cz.vut.fit.txtdirect.exceptions.MissingTargetException;
import cz.vut.fit.txtdirect.exceptions.RecordPolicyException;
import cz.vut.fit.txtdirect.exceptions.RecordSyntaxException;
import cz.vut.fit.txtdirect.exceptions.TxtDirectException;
import cz.vut.fit.txtdirect.http.RedirectRequest;
import cz.vut.fit.txtdirect.models.RecordType;
import cz.vut.fit.txtdirect.models.RedirectRecord;
import cz.vut.fit.txtdirect.models.ResolutionContext;
import cz.vut.fit.txtdirect.resolver.placeholders.PlaceholderExpander;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.LoggerFactory;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * Parses the directive string of a TXT answer into a {@link RedirectRecord}.
 * <p>
 * The text is split on {@code ;}, each segment is trimmed and matched by its key. Segments with a single
 * {@code =} and an unknown key are ignored, anything else that is not a known directive fails the parse.
 * Empty segments (e.g. after a trailing {@code ;}) are skipped. The parser never writes a response.
 */
public class DirectiveParser {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(DirectiveParser.class);

    /**
     * The maximum length of one directive segment, the size of a single DNS character-string.
     */
    public static final int MAX_SEGMENT_LENGTH = 255;

    private static final CharMatcher ALPHA = CharMatcher.inRange('a', 'z').or(CharMatcher.inRange('A', 'Z'));
    private static final CharMatcher DIGIT = CharMatcher.inRange('0', '9');
    private static final CharMatcher ALNUM = ALPHA.or(DIGIT);
    private static final CharMatcher HEX = DIGIT
            .or(CharMatcher.inRange('a', 'f'))
            .or(CharMatcher.inRange('A', 'F'));
    private static final CharMatcher HEADER_TOKEN = ALNUM.or(CharMatcher.anyOf("!#$%&'*+-.^_`|~"));
    private static final CharMatcher HEADER_VALUE_CONTROL = CharMatcher.javaIsoControl().and(CharMatcher.isNot('\t'));
    private static final CharMatcher URI_CONTROL = CharMatcher.inRange((char) 0, (char) 0x1f).or(CharMatcher.is((char) 0x7f));
    private static final CharMatcher SCHEME = ALNUM.or(CharMatcher.anyOf("+-."));
    // Non-ASCII host names are left to the client
    private static final CharMatcher HOST = ALNUM.or(CharMatcher.anyOf("-._~!$&'()*+,;=%"))
            .or(CharMatcher.inRange((char) 0x80, Character.MAX_VALUE));

    private final TxtDirectConfig _config;
    private final PlaceholderExpander _expander;

    public DirectiveParser(@NotNull TxtDirectConfig config, @NotNull PlaceholderExpander expander) {
        _config = config;
        _expander = expander;
    }

    /**
     * Parses a directive string.
     *
     * @param text    the TXT answer
     * @param request the request whose values are substituted into {@code to=}, {@code root=} and {@code from=}
     * @param context the resolution context so far; supplies path captures to the placeholders
     * @return the parsed record
     * @throws RecordSyntaxException   if the text is malformed
     * @throws MissingTargetException  if a host record has no target
     * @throws RecordPolicyException   if the record may not be served with the current configuration
     */
    @NotNull
    public RedirectRecord parse(@NotNull String text, @NotNull RedirectRequest request,
                                @Nullable ResolutionContext context) throws TxtDirectException {
        final var builder = RedirectRecord.builder();

        for (var segment : Splitter.on(';').trimResults().split(text)) {
            if (segment.isEmpty())
                continue;

            if (segment.length() > MAX_SEGMENT_LENGTH)
                throw new RecordSyntaxException("TXT record cannot exceed the maximum of "
                        + MAX_SEGMENT_LENGTH + " characters");

            if (segment.startsWith(">")) {
                parseHeader(segment, builder);
                continue;
            }

            final var eq = segment.indexOf('=');
            final var key = eq < 0 ? segment : segment.substring(0, eq);
            final var value = eq < 0 ? "" : segment.substring(eq + 1);

            switch (key) {
                case "v" -> {
                    if (!RedirectRecord.SUPPORTED_VERSION.equals(value))
                        throw new RecordSyntaxException("unhandled version '" + value + "'");
                    Logger.warn("{} is not suitable for production", RedirectRecord.SUPPORTED_VERSION);
                    builder.version(value);
                }
                case "code" -> builder.code(parseCode(value));
                case "from" -> builder.from(_expander.expand(value, request, context));
                case "re" -> builder.re(value);
                case "ref" -> builder.ref(parseBool(value));
                case "root" -> builder.root(validateUri("root", _expander.expand(value, request, context)));
                case "to" -> builder.to(validateUri("to", _expander.expand(value, request, context)));
                case "type" -> builder.type(value);
                case "use" -> {
                    if (!value.startsWith(RedirectRecord.UPSTREAM_ZONE_PREFIX))
                        throw new RecordSyntaxException("The given zone address is invalid: " + value);
                    builder.addUse(value);
                }
                case "vcs" -> builder.vcs(value);
                case "website" -> builder.website(validateUri("website", value));
                default -> {
                    if (eq < 0 || segment.indexOf('=', eq + 1) >= 0)
                        throw new RecordSyntaxException("arbitrary data not allowed");
                    Logger.trace("Ignoring unknown directive {}", key);
                }
            }
        }

        return validate(builder);
    }

    private RedirectRecord validate(RedirectRecord.Builder builder) throws TxtDirectException {
        if (builder.type() == RecordType.DOCKERV2 && builder.to().isEmpty())
            throw new RecordPolicyException("to= field is required in dockerv2 type");

        if (builder.code() == 0)
            builder.code(RedirectRecord.DEFAULT_CODE);

        // Records pointing to upstream zones are validated once the upstream record is known
        if (!builder.hasUpstream()) {
            if (builder.type() == null)
                builder.type(RecordType.HOST.tag());

            if (builder.type() == RecordType.HOST && builder.to().isEmpty())
                throw new MissingTargetException("host record has no to= target");

            final var record = builder.build();
            if (!_config.isEnabled(record.type()))
                throw new RecordPolicyException(record.typeName() + " type is not enabled in configuration");

            return record;
        }

        return builder.build();
    }

    private static void parseHeader(String segment, RedirectRecord.Builder builder) throws RecordSyntaxException {
        final var eq = segment.indexOf('=');
        if (eq < 0)
            throw new RecordSyntaxException("header directive without a value: " + segment);

        final var name = segment.substring(1, eq).trim();
        if (name.isEmpty())
            throw new RecordSyntaxException("header directive without a name: " + segment);

        if (!HEADER_TOKEN.matchesAllOf(name))
            throw new RecordSyntaxException("invalid header name: " + name);

        final String value;
        try {
            // Only percent-escapes are decoded, a plus sign stays a plus sign
            value = URLDecoder.decode(segment.substring(eq + 1).replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new RecordSyntaxException("invalid escape in header " + name, e);
        }

        // A decoded CR or LF would split the response header
        if (HEADER_VALUE_CONTROL.matchesAnyOf(value))
            throw new RecordSyntaxException("control character in value of header " + name);

        builder.header(name, value);
    }

    private static int parseCode(String value) throws RecordSyntaxException {
        final int code;
        try {
            code = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new RecordSyntaxException("could not parse status code: " + value, e);
        }

        // Zero leaves the default in place
        if (code != 0 && (code < 100 || code > 999))
            throw new RecordSyntaxException("status code out of range: " + value);
        return code;
    }

    /**
     * Parses a boolean the way {@code ref=} values have always been accepted.
     */
    static boolean parseBool(String value) throws RecordSyntaxException {
        return switch (value) {
            case "1", "t", "T", "TRUE", "true", "True" -> true;
            case "0", "f", "F", "FALSE", "false", "False" -> false;
            default -> throw RecordSyntaxException.permanent("invalid ref= value: " + value, null);
        };
    }

    /**
     * Checks a target URI and returns it unchanged. Only URIs that cannot be sent in a {@code Location} header
     * are refused: control characters, broken percent-escapes and a malformed host or port. Spaces, braces
     * and other characters a browser escapes on its own are allowed.
     */
    static String validateUri(String key, String value) throws RecordSyntaxException {
        if (URI_CONTROL.matchesAnyOf(value))
            throw RecordSyntaxException.permanent("invalid " + key + "= URI: control character in " + value, null);

        // The query is passed through untouched, the rest must carry valid escapes
        final var queryStart = value.indexOf('?');
        final var fragmentStart = value.indexOf('#');
        final var checked = queryStart >= 0 && (fragmentStart < 0 || queryStart < fragmentStart)
                ? value.substring(0, queryStart) + (fragmentStart < 0 ? "" : value.substring(fragmentStart))
                : value;
        if (!hasValidEscapes(checked))
            throw RecordSyntaxException.permanent("invalid " + key + "= URI: invalid escape in " + value, null);

        if (value.startsWith(":"))
            throw RecordSyntaxException.permanent("invalid " + key + "= URI: missing scheme in " + value, null);

        final var authorityStart = value.indexOf("://");
        if (authorityStart > 0 && isScheme(value.substring(0, authorityStart))) {
            final var rest = value.substring(authorityStart + 3);
            var end = rest.length();
            for (var c : new char[]{'/', '?', '#'}) {
                final var i = rest.indexOf(c);
                if (i >= 0 && i < end)
                    end = i;
            }

            final var authority = rest.substring(0, end);
            final var hostPort = authority.substring(authority.lastIndexOf('@') + 1);
            if (!isValidHostPort(hostPort))
                throw RecordSyntaxException.permanent("invalid " + key + "= URI: invalid host in " + value, null);
        }

        return value;
    }

    private static boolean hasValidEscapes(String value) {
        for (var i = value.indexOf('%'); i >= 0; i = value.indexOf('%', i + 1)) {
            if (i + 2 >= value.length() || !HEX.matches(value.charAt(i + 1)) || !HEX.matches(value.charAt(i + 2)))
                return false;
        }
        return true;
    }

    private static boolean isScheme(String scheme) {
        return !scheme.isEmpty() && ALPHA.matches(scheme.charAt(0)) && SCHEME.matchesAllOf(scheme);
    }

    private static boolean isValidHostPort(String hostPort) {
        final String host;
        final String port;
        if (hostPort.startsWith("[")) {
            final var close = hostPort.indexOf(']');
            if (close < 0)
                return false;
            host = "";
            final var after = hostPort.substring(close + 1);
            if (!after.isEmpty() && !after.startsWith(":"))
                return false;
            port = after.isEmpty() ? "" : after.substring(1);
        } else {
            final var colon = hostPort.lastIndexOf(':');
            host = colon < 0 ? hostPort : hostPort.substring(0, colon);
            port = colon < 0 ? "" : hostPort.substring(colon + 1);
        }

        return HOST.matchesAllOf(host) && DIGIT.matchesAllOf(port);
    }
}
