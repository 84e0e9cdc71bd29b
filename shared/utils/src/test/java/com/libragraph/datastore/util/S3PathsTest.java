package com.libragraph.datastore.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

class S3PathsTest {

    // --- bucketKey ---

    @Test
    void bucketKeySplitsBucketAndKey() {
        BucketKey bk = S3Paths.bucketKey("s3://hello/world");
        assertThat(bk.bucket()).isEqualTo("hello");
        assertThat(bk.key()).isEqualTo("world");
    }

    @Test
    void bucketKeyWithNestedKey() {
        BucketKey bk = S3Paths.bucketKey("s3://foo/bar/baz/dummy");
        assertThat(bk.bucket()).isEqualTo("foo");
        assertThat(bk.key()).isEqualTo("bar/baz/dummy");
    }

    @Test
    void bucketKeyWithEmptyKey() {
        BucketKey bk = S3Paths.bucketKey("s3://hello/");
        assertThat(bk.bucket()).isEqualTo("hello");
        assertThat(bk.key()).isEmpty();
    }

    @Test
    void bucketKeyOfSchemeOnly() {
        BucketKey bk = S3Paths.bucketKey("s3://");
        assertThat(bk.bucket()).isEmpty();
        assertThat(bk.key()).isEmpty();
    }

    @Test
    void bucketKeyKeepsTrailingSeparator() {
        BucketKey bk = S3Paths.bucketKey("s3://hello/world/");
        assertThat(bk.bucket()).isEqualTo("hello");
        assertThat(bk.key()).isEqualTo("world/");
    }

    @Test
    void bucketKeyWithoutKeySeparator() {
        BucketKey bk = S3Paths.bucketKey("s3://hello");
        assertThat(bk.bucket()).isEqualTo("hello");
        assertThat(bk.key()).isEmpty();
    }

    @Test
    void bucketKeyRejectsPlainForm() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> S3Paths.bucketKey("hello/world"))
                .withMessageContaining("hello/world");
    }

    @Test
    void bucketKeyRejectsNull() {
        assertThatNullPointerException()
                .isThrownBy(() -> S3Paths.bucketKey(null));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "s3://hello/world",
            "s3://hello/",
            "s3://hello/world/",
            "s3://foo/bar/baz/dummy",
            "s3://dummy_bucket/wicker/d/__COLUMN_CONCATENATED_FILES__/",
    })
    void bucketKeyRecomposesToOriginal(String address) {
        BucketKey bk = S3Paths.bucketKey(address);
        assertThat(S3Paths.SCHEME + bk.bucket() + "/" + bk.key()).isEqualTo(address);
        assertThat(bk.toUrl()).isEqualTo(address);
    }

    @Test
    void toUrlOfEmptyPairIsScheme() {
        assertThat(S3Paths.toUrl(new BucketKey("", ""))).isEqualTo("s3://");
    }

    // --- join ---

    @Test
    void joinInsertsSeparator() {
        assertThat(S3Paths.join("/m", "bucket/key")).isEqualTo("/m/bucket/key");
    }

    @Test
    void joinCollapsesTrailingSeparatorOnRoot() {
        assertThat(S3Paths.join("/m/", "bucket/key")).isEqualTo("/m/bucket/key");
    }

    @Test
    void joinCollapsesLeadingSeparatorOnChild() {
        assertThat(S3Paths.join("/m/", "/bucket/key")).isEqualTo("/m/bucket/key");
        assertThat(S3Paths.join("/m", "/bucket/key")).isEqualTo("/m/bucket/key");
    }

    @Test
    void joinWithEmptyRootReturnsChild() {
        assertThat(S3Paths.join("", "bucket/key")).isEqualTo("bucket/key");
    }

    @Test
    void joinWithEmptyChildReturnsRoot() {
        assertThat(S3Paths.join("s3://bucket/root/", "")).isEqualTo("s3://bucket/root/");
    }

    @Test
    void joinKeepsChildTrailingSeparator() {
        assertThat(S3Paths.join("s3://bucket", "dir/")).isEqualTo("s3://bucket/dir/");
    }

    @Test
    void joinSegments() {
        assertThat(S3Paths.join("s3://dummy_bucket/wicker/", "d", "__COLUMN_CONCATENATED_FILES__"))
                .isEqualTo("s3://dummy_bucket/wicker/d/__COLUMN_CONCATENATED_FILES__");
    }

    // --- prefixes ---

    @Test
    void stripPrefixRemovesLeadingText() {
        assertThat(S3Paths.stripPrefix("s3://dummy_bucket/wicker/x", "s3://dummy_bucket/"))
                .isEqualTo("wicker/x");
    }

    @Test
    void stripPrefixRejectsMismatch() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> S3Paths.stripPrefix("s3://dummy_bucket/wicker/x", "s3://other/"))
                .withMessageContaining("s3://other/");
    }

    @Test
    void removeSchemeYieldsBucketRelativePath() {
        assertThat(S3Paths.removeScheme("s3://dummy_bucket/wicker/x")).isEqualTo("dummy_bucket/wicker/x");
    }

    @Test
    void isUrlDistinguishesForms() {
        assertThat(S3Paths.isUrl("s3://bucket/key")).isTrue();
        assertThat(S3Paths.isUrl("bucket/key")).isFalse();
        assertThat(S3Paths.isUrl("/mnt/bucket/key")).isFalse();
        assertThat(S3Paths.isUrl(null)).isFalse();
    }

    @Test
    void trimTrailingSeparator() {
        assertThat(S3Paths.trimTrailingSeparator("s3://bucket/root/")).isEqualTo("s3://bucket/root");
        assertThat(S3Paths.trimTrailingSeparator("s3://bucket/root")).isEqualTo("s3://bucket/root");
        assertThat(S3Paths.trimTrailingSeparator("/")).isEqualTo("/");
        assertThat(S3Paths.trimTrailingSeparator("s3://")).isEqualTo("s3://");
    }
}
