package com.williamcallahan.tutormemory;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = {
        "app.extraction.api-key=",
        "app.prompt.tokenizer=character"
})
class TutorMemoryApplicationTests {

    @Test
    void contextLoads() {
    }

}
