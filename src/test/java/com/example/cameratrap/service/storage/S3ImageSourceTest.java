package com.example.cameratrap.service.storage;

import com.example.cameratrap.exception.ImageDecodeException;
import com.example.cameratrap.exception.StorageUnavailableException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Exception;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class S3ImageSourceTest {

    @Mock
    private S3Client s3Client;

    @InjectMocks
    private S3ImageSource source;

    @Test
    void returnsObjectBytes() {
        byte[] payload = {(byte) 0xFF, (byte) 0xD8, 0x01};
        when(s3Client.getObjectAsBytes(argThat((GetObjectRequest request) ->
                "traps".equals(request.bucket()) && "a/b.jpg".equals(request.key()))))
                .thenReturn(ResponseBytes.fromByteArray(GetObjectResponse.builder().build(), payload));

        assertThat(source.load("traps", "a/b.jpg")).containsExactly(payload);
    }

    @Test
    void missingObjectIsPermanent() {
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenThrow(NoSuchKeyException.builder().message("The specified key does not exist.").build());

        assertThatThrownBy(() -> source.load("traps", "a/b.jpg"))
                .isInstanceOf(ImageDecodeException.class)
                .hasMessageContaining("does not exist");
    }

    @Test
    void emptyObjectIsPermanent() {
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenReturn(ResponseBytes.fromByteArray(GetObjectResponse.builder().build(), new byte[0]));

        assertThatThrownBy(() -> source.load("traps", "a/b.jpg"))
                .isInstanceOf(ImageDecodeException.class);
    }

    @Test
    void throttlingIsTransient() {
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenThrow((S3Exception) S3Exception.builder().statusCode(503).message("Slow Down").build());

        assertThatThrownBy(() -> source.load("traps", "a/b.jpg"))
                .isInstanceOf(StorageUnavailableException.class)
                .matches(ex -> ((StorageUnavailableException) ex).isRetryable());
    }

    @Test
    void accessDeniedIsPermanent() {
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenThrow((S3Exception) S3Exception.builder().statusCode(403).message("Access Denied").build());

        assertThatThrownBy(() -> source.load("traps", "a/b.jpg"))
                .isInstanceOf(ImageDecodeException.class);
    }

    @Test
    void networkErrorsAreTransient() {
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenThrow(SdkClientException.create("Unable to execute HTTP request"));

        assertThatThrownBy(() -> source.load("traps", "a/b.jpg"))
                .isInstanceOf(StorageUnavailableException.class);
    }
}
