package com.pileupbuster.backend;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import com.pileupbuster.backend.service.QueueCoordinator;
import com.pileupbuster.backend.store.InMemoryStateStore;
import com.pileupbuster.backend.store.StateStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

@SpringBootTest(
    properties = {
      "pileup.store.type=memory",
      "pileup.qrz.enabled=false",
      "pileup.scheduling.enabled=false"
    })
class PileupBackendApplicationTests {
  @Autowired
  private ApplicationContext applicationContext;

  @Autowired
  private StateStore stateStore;

  @Test
  void contextLoads() {
    assertNotNull(applicationContext.getBean(QueueCoordinator.class));
    assertInstanceOf(InMemoryStateStore.class, stateStore);
  }
}
