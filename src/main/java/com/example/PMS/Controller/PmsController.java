package com.example.PMS.Controller;

import com.example.PMS.DTO.MessageResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class PmsController {

    @GetMapping("/")
    public MessageResponse index() {
        return new MessageResponse("Parking Management API");
    }
}
