package com.calai.dietworkout.predictor;

import com.calai.dietworkout.testsupport.BaseSpringTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

/** test profile 指向不存在的模型檔 -> 啟動不能掛，要退回 heuristic */
@SpringBootTest
class PredictorFallbackWiringTest extends BaseSpringTest {

    @Autowired Predictor predictor;
    @Autowired PredictorHealthIndicator health;

    @Test
    void missing_model_falls_back_to_heuristic_and_stays_up() {
        assertThat(predictor).isInstanceOf(HeuristicPredictor.class);

        Health h = health.health();
        assertThat(h.getStatus()).isEqualTo(Status.UP);
        assertThat(h.getDetails())
                .containsEntry("predictor", "HEURISTIC")
                .containsEntry("fallback", true)
                .containsKey("reason");
    }
}
