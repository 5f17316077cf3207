package com.calai.dietworkout;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HomeController {
    public record Welcome(String message) {}

    static final String WELCOME_MESSAGE =
            "Welcome to the Diet & Workout API. Use the /predict endpoint with a POST request to get predictions.";

    /** 存活確認用：固定回歡迎訊息 */
    @GetMapping("/")
    public Welcome home() {
        return new Welcome(WELCOME_MESSAGE);
    }
}
