package com.example.cameratrap.service.storage;

import com.example.cameratrap.exception.ImageDecodeException;
import com.example.cameratrap.exception.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Exception;

@Component
public class S3ImageSource implements ImageSource {

    private static final Logger log = LoggerFactory.getLogger(S3ImageSource.class);

    private final S3Client s3Client;

    public S3ImageSource(S3Client s3Client) {
        this.s3Client = s3Client;
    }

    @Override
    public byte[] load(String bucket, String key) {
        GetObjectRequest request = GetObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();
        try {
            ResponseBytes<GetObjectResponse> response = s3Client.getObjectAsBytes(request);
            byte[] data = response.asByteArray();
            if (data.length == 0) {
                throw new ImageDecodeException("Object s3://" + bucket + "/" + key + " is empty");
            }
            log.debug("Fetched {} bytes from s3://{}/{}", data.length, bucket, key);
            return data;
        } catch (NoSuchKeyException | NoSuchBucketException ex) {
            throw new ImageDecodeException("Object s3://" + bucket + "/" + key + " does not exist", ex);
        } catch (S3Exception ex) {
            if (ex.statusCode() >= 500 || ex.statusCode() == 429) {
                throw new StorageUnavailableException("S3 returned " + ex.statusCode() + " for " + key, ex);
            }
            throw new ImageDecodeException("Unable to read s3://" + bucket + "/" + key + ": " + ex.getMessage(), ex);
        } catch (SdkClientException ex) {
            throw new StorageUnavailableException("S3 unreachable while reading " + key, ex);
        }
    }
}
