package com.example.delivery;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.delivery.service.RunExecutor;
import com.example.delivery.transport.DeliveryTransport;
import com.example.delivery.transport.FailureInjectingDeliveryTransport;
import com.example.delivery.worker.SchedulerTickWorker;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class DeliveryEngineApplicationTests extends AbstractPostgresContainerTest {

  @Autowired private ApplicationContext context;

  @Autowired private DeliveryTransport deliveryTransport;

  @Test
  void contextLoadsWithTestWiring() {
    assertThat(context.getBean(RunExecutor.class)).isNotNull();
    // このプロファイルではポーリングをテストから駆動する
    assertThat(context.getBeansOfType(SchedulerTickWorker.class)).isEmpty();
    assertThat(deliveryTransport).isInstanceOf(FailureInjectingDeliveryTransport.class);
  }
}
