package io.durastream.storage;

/**
 * Optional knobs for an append.
 *
 * @param seq          writer-coordination token; must sort after the last accepted one (may be null)
 * @param contentType  if set, must match the stream's content type (may be null)
 * @param producer     idempotent producer identity (may be null)
 * @param close        close the stream atomically after this append
 */
public record AppendOptions(String seq, String contentType, ProducerInfo producer, boolean close) {

    private static final AppendOptions NONE = new AppendOptions(null, null, null, false);

    public static AppendOptions none() {
        return NONE;
    }

    public static AppendOptions withProducer(ProducerInfo producer) {
        return new AppendOptions(null, null, producer, false);
    }

    public AppendOptions closing() {
        return new AppendOptions(seq, contentType, producer, true);
    }
}
