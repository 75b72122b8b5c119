package com.novemberain.quartz.store.util;

import com.novemberain.quartz.store.CorruptJobDataException;
import org.apache.commons.codec.binary.Base64;
import org.quartz.JobDataMap;
import org.quartz.JobPersistenceException;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.NotSerializableException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.util.HashMap;
import java.util.Map;

/**
 * Java serialization of the values that are stored opaquely: calendars, triggers
 * without a properties converter, and job data maps kept as base64 text.
 */
public class SerialUtils {

    /**
     * Serializes calendars and triggers that have no dedicated converter.
     */
    public static byte[] serialize(Object object) throws JobPersistenceException {
        try {
            return toBytes(object);
        } catch (IOException e) {
            throw new JobPersistenceException("Could not serialize " + object.getClass().getName(), e);
        }
    }

    public static <T> T deserialize(byte[] serialized, Class<T> clazz) throws JobPersistenceException {
        if (serialized == null) {
            throw new CorruptJobDataException("Missing serialized " + clazz.getSimpleName());
        }
        Object deserialized;
        try {
            deserialized = fromBytes(serialized);
        } catch (IOException | ClassNotFoundException e) {
            throw new CorruptJobDataException("Could not deserialize " + clazz.getSimpleName(), e);
        }
        if (!clazz.isInstance(deserialized)) {
            throw new CorruptJobDataException("Deserialized object is not of the desired type "
                    + clazz.getName());
        }
        return clazz.cast(deserialized);
    }

    /**
     * @throws NotSerializableException naming the first entry whose value can't be serialized
     */
    public static String serialize(JobDataMap jobDataMap) throws IOException {
        Map<String, Object> entries = new HashMap<>(jobDataMap.getWrappedMap());
        try {
            return Base64.encodeBase64String(toBytes(entries));
        } catch (NotSerializableException e) {
            throw new NotSerializableException("Unable to serialize JobDataMap for insertion into database"
                    + " because the value of property '" + firstNonSerializableKey(entries)
                    + "' is not serializable: " + e.getMessage());
        }
    }

    public static Map<String, ?> deserialize(String base64) throws JobPersistenceException {
        try {
            @SuppressWarnings("unchecked")
            Map<String, ?> map = (Map<String, ?>) fromBytes(Base64.decodeBase64(base64));
            return map;
        } catch (IOException | ClassNotFoundException | ClassCastException e) {
            throw new CorruptJobDataException("Could not deserialize job data: " + e.getMessage(), e);
        }
    }

    private static byte[] toBytes(Object object) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(object);
        }
        return bytes.toByteArray();
    }

    private static Object fromBytes(byte[] serialized) throws IOException, ClassNotFoundException {
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(serialized))) {
            return in.readObject();
        }
    }

    private static String firstNonSerializableKey(Map<String, ?> entries) {
        for (Map.Entry<String, ?> entry : entries.entrySet()) {
            try {
                toBytes(entry.getValue());
            } catch (IOException e) {
                return entry.getKey();
            }
        }
        return null;
    }
}
