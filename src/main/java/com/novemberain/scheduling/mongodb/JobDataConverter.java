package com.novemberain.scheduling.mongodb;

import com.novemberain.scheduling.JobPersistenceException;
import com.novemberain.scheduling.mongodb.util.SerialUtils;
import org.bson.Document;
import org.quartz.JobDataMap;

import java.io.IOException;
import java.util.Map;

/**
 * Converter between {@link JobDataMap} and mongo {@link Document}, used for
 * both job and trigger data.
 */
public class JobDataConverter {

    private final boolean base64Preferred;

    /**
     * @param base64Preferred store data as a {@code base64} encoded
     *                        serialized map instead of a sub-document
     */
    public JobDataConverter(final boolean base64Preferred) {
        this.base64Preferred = base64Preferred;
    }

    public boolean isBase64Preferred() {
        return base64Preferred;
    }

    /**
     * Write {@code from} into {@code to}, under '{@value Constants#JOB_DATA}'
     * when {@code base64} is preferred, under '{@value Constants#JOB_DATA_PLAIN}'
     * otherwise. An empty map writes nothing.
     *
     * @throws JobPersistenceException if a value cannot be serialized
     */
    public void toDocument(JobDataMap from, Document to) throws JobPersistenceException {
        if (from == null || from.isEmpty()) {
            return;
        }
        if (base64Preferred) {
            try {
                to.put(Constants.JOB_DATA, SerialUtils.serialize(from));
            } catch (IOException e) {
                throw new JobPersistenceException("Could not serialize job data.", e);
            }
        } else {
            to.put(Constants.JOB_DATA_PLAIN, new Document(from.getWrappedMap()));
        }
    }

    /**
     * Read the data stored in {@code from}. The plain field wins when both
     * are present, so documents written before a switch of the preference
     * stay readable.
     *
     * @return a map with a clear dirty flag, empty when nothing was stored
     * @throws JobPersistenceException if the encoded map cannot be decoded
     */
    public JobDataMap toJobData(Document from) throws JobPersistenceException {
        JobDataMap jobData = new JobDataMap();
        Document plain = from.get(Constants.JOB_DATA_PLAIN, Document.class);
        if (plain != null) {
            jobData.putAll(plain);
        } else {
            String encoded = from.getString(Constants.JOB_DATA);
            if (encoded != null) {
                jobData.putAll(decode(encoded));
            }
        }
        jobData.clearDirtyFlag();
        return jobData;
    }

    private Map<String, ?> decode(String encoded) throws JobPersistenceException {
        try {
            return SerialUtils.deserialize(encoded);
        } catch (IOException e) {
            throw new JobPersistenceException("Could not deserialize job data.", e);
        }
    }
}
