package cz.vut.fit.txtdirect.models;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The redirect behaviors a record may select with its {@code type=} directive.
 * {@link #UNSUPPORTED} stands for any other value; it is never enabled.
 */
public enum RecordType {
    HOST("host"),
    PATH("path"),
    PROXY("proxy"),
    DOCKERV2("dockerv2"),
    GOMETA("gometa"),
    GOMODS("gomods"),
    UNSUPPORTED("");

    private final String _tag;

    RecordType(String tag) {
        _tag = tag;
    }

    /**
     * The value used in the {@code type=} directive and in the configuration.
     */
    @NotNull
    public String tag() {
        return _tag;
    }

    /**
     * Maps a directive value to a type.
     *
     * @param tag the value of the {@code type=} directive
     * @return the matching type or {@link #UNSUPPORTED}; null if the tag is null or empty
     */
    @Nullable
    public static RecordType fromTag(@Nullable String tag) {
        if (tag == null || tag.isEmpty())
            return null;

        for (var type : values()) {
            if (type != UNSUPPORTED && type._tag.equals(tag))
                return type;
        }
        return UNSUPPORTED;
    }
}
