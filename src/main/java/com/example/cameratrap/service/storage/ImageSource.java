package com.example.cameratrap.service.storage;

/**
 * Reads uploaded image objects.
 */
public interface ImageSource {

    /**
     * @throws com.example.cameratrap.exception.ImageDecodeException          when the object does
     *                                                                        not exist or is empty
     * @throws com.example.cameratrap.exception.StorageUnavailableException   when the store cannot
     *                                                                        be reached
     */
    byte[] load(String bucket, String key);
}
