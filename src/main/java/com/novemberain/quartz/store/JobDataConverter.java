package com.novemberain.quartz.store;

import com.novemberain.quartz.store.util.SerialUtils;
import org.bson.Document;
import org.quartz.JobDataMap;
import org.quartz.JobPersistenceException;

import java.io.IOException;
import java.util.Map;

/**
 * Converter between {@link JobDataMap} and a stored {@link Document}.
 */
public class JobDataConverter {

	private final boolean base64Preferred;

	/**
	 * @param base64Preferred if job data should be serialized and stored {@code base64} encoded.
	 */
	public JobDataConverter(final boolean base64Preferred) {
		this.base64Preferred = base64Preferred;
	}

	/**
	 * Writes the job data map into the document, either as a {@code base64} string in
	 * '{@value Constants#JOB_DATA}' or as a plain map in '{@value Constants#JOB_DATA_PLAIN}'.
	 * @throws JobPersistenceException if a value is not serializable.
	 */
	public void toDocument(JobDataMap from, Document to) throws JobPersistenceException {
		if (from.isEmpty()) {
			return;
		}
		if (base64Preferred) {
			try {
				to.put(Constants.JOB_DATA, SerialUtils.serialize(from));
			} catch (IOException e) {
				throw new JobPersistenceException("Could not serialise job data: " + e.getMessage(), e);
			}
		} else {
			to.put(Constants.JOB_DATA_PLAIN, new Document(from.getWrappedMap()));
		}
	}

	/**
	 * Reads whichever representation the document carries, the preferred one first.
	 * @return if {@link JobDataMap} has been populated.
	 * @throws CorruptJobDataException if stored data could not be decoded.
	 */
	public boolean toJobData(Document from, JobDataMap to) throws JobPersistenceException {
		if (base64Preferred) {
			return toJobDataFromBase64(from, to) || toJobDataFromField(from, to);
		}
		return toJobDataFromField(from, to) || toJobDataFromBase64(from, to);
	}

	private boolean toJobDataFromBase64(Document from, JobDataMap to) throws JobPersistenceException {
		String jobDataBase64String = from.getString(Constants.JOB_DATA);
		if (jobDataBase64String == null) {
			return false;
		}
		to.putAll(SerialUtils.deserialize(jobDataBase64String));
		return true;
	}

	private boolean toJobDataFromField(Document from, JobDataMap to) {
		@SuppressWarnings("unchecked")
		Map<String, ?> jobDataMap = from.get(Constants.JOB_DATA_PLAIN, Map.class);
		if (jobDataMap == null) {
			return false;
		}
		to.putAll(jobDataMap);
		return true;
	}
}
