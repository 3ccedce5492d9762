package com.rit.obj;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Blob 测试")
class BlobTest {

    /**
     * toBytes() 返回与构造时传入的字节一致，且修改原数组不影响 blob。
     */
    @Test
    @DisplayName("toBytes 返回与构造一致的字节")
    void toBytes_returnsSameData() {
        byte[] data = "hello world".getBytes(StandardCharsets.UTF_8);
        Blob blob = new Blob(data);
        data[0] = 'j';
        assertThat(blob.toBytes()).isEqualTo("hello world".getBytes(StandardCharsets.UTF_8));
        assertThat(blob.getText()).isEqualTo("hello world");
        assertThat(blob.toBytes()).hasSize(11);
    }

    @Test
    @DisplayName("null 内容视为空 blob")
    void nullData_isEmpty() {
        assertThat(new Blob(null).toBytes()).isEmpty();
        assertThat(Blob.ofText("").getText()).isEmpty();
    }
}
