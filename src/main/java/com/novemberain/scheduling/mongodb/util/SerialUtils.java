package com.novemberain.scheduling.mongodb.util;

import org.apache.commons.codec.binary.Base64;
import org.quartz.JobDataMap;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InvalidObjectException;
import java.io.NotSerializableException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.util.Map;

/**
 * Base64 encoding of job data maps.
 */
public class SerialUtils {

    private static final String SERIALIZE_MESSAGE_FORMAT =
            "Unable to serialize job data for insertion into " +
            "database because the value of property '%s' " +
            "is not serializable: %s";

    public static String serialize(JobDataMap jobDataMap) throws IOException {
        try {
            byte[] bytes = mapToBytes(jobDataMap.getWrappedMap());
            return Base64.encodeBase64String(bytes);
        } catch (NotSerializableException e) {
            throw new NotSerializableException(String.format(SERIALIZE_MESSAGE_FORMAT,
                    keyOfNonSerializableEntry(jobDataMap.getWrappedMap()), e.getMessage()));
        }
    }

    public static Map<String, ?> deserialize(String encoded) throws IOException {
        byte[] bytes = Base64.decodeBase64(encoded);
        try (ObjectInputStream ois = new ObjectInputStream(new ByteArrayInputStream(bytes))) {
            Object decoded = ois.readObject();
            if (!(decoded instanceof Map)) {
                throw new InvalidObjectException("Encoded job data is not a map: " + decoded);
            }
            @SuppressWarnings("unchecked")
            Map<String, ?> map = (Map<String, ?>) decoded;
            return map;
        } catch (ClassNotFoundException e) {
            throw new IOException("Job data references an unknown class: " + e.getMessage(), e);
        }
    }

    private static byte[] mapToBytes(Object object) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(baos)) {
            out.writeObject(object);
        }
        return baos.toByteArray();
    }

    private static String keyOfNonSerializableEntry(Map<String, ?> data) {
        for (Map.Entry<String, ?> entry : data.entrySet()) {
            try {
                mapToBytes(entry.getValue());
            } catch (IOException e) {
                return entry.getKey();
            }
        }
        return null;
    }
}
