package com.hmmselect.server;

import com.hmmselect.server.service.ModelSelectionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class ModelSelectionApplicationTest {

    @Autowired
    private ModelSelectionService service;

    @Test
    void testContextProvidesConfiguredService() {
        assertNotNull(service);
        assertEquals("bic", service.getConfig().selector);
        assertEquals(2, service.getConfig().minComponents);
        assertEquals(10, service.getConfig().maxComponents);
    }
}
