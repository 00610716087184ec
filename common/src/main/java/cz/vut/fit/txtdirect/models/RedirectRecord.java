package cz.vut.fit.txtdirect.models;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A set of redirect directives parsed from a single DNS TXT answer.
 *
 * @param version  The value of the {@code v=} directive.
 * @param to       The redirect target, placeholders already expanded.
 * @param root     The target used by path records for the root path.
 * @param website  The target of the "website" fallback.
 * @param code     The HTTP status code used when redirecting.
 * @param type     The selected behavior. Null only for records that point to upstream zones and do not set a type.
 * @param typeName The raw value of the {@code type=} directive (used in messages for unsupported types).
 * @param use      Upstream zones to try, in declaration order.
 * @param vcs      The version control system announced by gometa records.
 * @param from     A path template mapping path segments to sub-zone labels.
 * @param re       A regular expression whose capture groups become sub-zone labels.
 * @param ref      If true, redirects carry the requested host in the {@code Referer} header.
 * @param headers  Response headers requested by {@code >Name=Value} directives.
 */
public record RedirectRecord(
        @Nullable String version,
        @NotNull String to,
        @NotNull String root,
        @NotNull String website,
        int code,
        @Nullable RecordType type,
        @NotNull String typeName,
        @NotNull List<String> use,
        @NotNull String vcs,
        @NotNull String from,
        @NotNull String re,
        boolean ref,
        @NotNull Map<String, String> headers
) {
    /**
     * The only directive language version understood.
     */
    public static final String SUPPORTED_VERSION = "txtv0";

    /**
     * The label every redirect zone starts with; {@code use=} values must begin with it.
     */
    public static final String BASE_ZONE = "_redirect";

    public static final String UPSTREAM_ZONE_PREFIX = BASE_ZONE + ".";

    /**
     * Status used when a record does not specify {@code code=}.
     */
    public static final int DEFAULT_CODE = 302;

    public RedirectRecord {
        use = List.copyOf(use);
        headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public boolean hasUpstream() {
        return !use.isEmpty();
    }

    @NotNull
    public static Builder builder() {
        return new Builder();
    }

    /**
     * A mutable accumulator used while the directives of a record are being read.
     */
    public static final class Builder {
        private String _version;
        private String _to = "";
        private String _root = "";
        private String _website = "";
        private int _code;
        private RecordType _type;
        private String _typeName = "";
        private final List<String> _use = new ArrayList<>();
        private String _vcs = "";
        private String _from = "";
        private String _re = "";
        private boolean _ref;
        private final Map<String, String> _headers = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder version(String version) {
            _version = version;
            return this;
        }

        public Builder to(@NotNull String to) {
            _to = to;
            return this;
        }

        public Builder root(@NotNull String root) {
            _root = root;
            return this;
        }

        public Builder website(@NotNull String website) {
            _website = website;
            return this;
        }

        public Builder code(int code) {
            _code = code;
            return this;
        }

        public Builder type(@NotNull String typeName) {
            _typeName = typeName;
            _type = RecordType.fromTag(typeName);
            return this;
        }

        public Builder addUse(@NotNull String zone) {
            _use.add(zone);
            return this;
        }

        public Builder vcs(@NotNull String vcs) {
            _vcs = vcs;
            return this;
        }

        public Builder from(@NotNull String from) {
            _from = from;
            return this;
        }

        public Builder re(@NotNull String re) {
            _re = re;
            return this;
        }

        public Builder ref(boolean ref) {
            _ref = ref;
            return this;
        }

        public Builder header(@NotNull String name, @NotNull String value) {
            _headers.put(name, value);
            return this;
        }

        public String to() {
            return _to;
        }

        public int code() {
            return _code;
        }

        public RecordType type() {
            return _type;
        }

        public boolean hasUpstream() {
            return !_use.isEmpty();
        }

        public RedirectRecord build() {
            return new RedirectRecord(_version, _to, _root, _website, _code, _type, _typeName,
                    _use, _vcs, _from, _re, _ref, _headers);
        }
    }
}
