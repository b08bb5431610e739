package com.questrail.dtchat.message;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * User-visible payload of a {@link ChatMessage}.
 *
 * <p>This is the semantic form. Wire representation lives in the codec layer
 * ({@code com.questrail.dtchat.codec.WirePayload}).</p>
 */
public sealed interface MessageContent
        permits MessageContent.Text, MessageContent.File
{
    /**
     * Approximate payload size in bytes, for logging.
     */
    int size();

    /**
     * Short human-readable description for views and logs.
     */
    String describe();

    record Text(String text) implements MessageContent
    {
        public Text {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public int size() {
            return text.getBytes(StandardCharsets.UTF_8).length;
        }

        @Override
        public String describe() {
            return text;
        }
    }

    /**
     * A named binary attachment. The data array is copied on the way in and out.
     */
    final class File implements MessageContent
    {
        private final String name;
        private final byte[] data;

        public File(String name, byte[] data) {
            this.name = Objects.requireNonNull(name, "name");
            this.data = Objects.requireNonNull(data, "data").clone();
        }

        public String name() {
            return name;
        }

        public byte[] data() {
            return data.clone();
        }

        @Override
        public int size() {
            return data.length;
        }

        @Override
        public String describe() {
            return "[file " + name + ", " + data.length + " bytes]";
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof File that)) return false;
            return name.equals(that.name) && Arrays.equals(data, that.data);
        }

        @Override
        public int hashCode() {
            return 31 * name.hashCode() + Arrays.hashCode(data);
        }

        @Override
        public String toString() {
            return "File[name=" + name + ", length=" + data.length + ']';
        }
    }
}
