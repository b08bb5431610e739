package com.questrail.dtchat.codec;

import java.util.Arrays;
import java.util.Objects;

/**
 * Tagged payload of a {@link WireEnvelope}: exactly one of Text, File or Ack.
 *
 * <p>Closed on purpose. Every decode site switches over the permitted
 * subtypes; an envelope without a payload never reaches protocol code because
 * the decoder rejects it.</p>
 */
public sealed interface WirePayload
        permits WirePayload.Text, WirePayload.File, WirePayload.Ack
{
    record Text(String text) implements WirePayload
    {
        public Text {
            Objects.requireNonNull(text, "text");
        }
    }

    final class File implements WirePayload
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

    /**
     * Acknowledges the message with the given uuid.
     */
    record Ack(String messageUuid) implements WirePayload
    {
        public Ack {
            Objects.requireNonNull(messageUuid, "messageUuid");
        }
    }
}
