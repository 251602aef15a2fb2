package io.etl4j;

import io.etl4j.core.FormattedOutput;
import io.etl4j.core.PlainCredentials;

/**
 * Uploads a formatted file. One implementation per destination type ({@code SFTP}, {@code GoogleDrive}, ...).
 *
 * <p>Credentials are already decrypted and, for OAuth types, already refreshed.
 */
public interface DestinationClient {

    String type();

    void upload(FormattedOutput output, PlainCredentials credentials) throws Exception;
}
