package id.go.kemenkeu.djpbn.sakti.zk.example;

import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/samples")
public class SampleController {

    private final SampleService sampleService;

    public SampleController(SampleService sampleService) {
        this.sampleService = sampleService;
    }

    @PostMapping("/{orderNumber}")
    public Map<String, String> process(@PathVariable String orderNumber) {
        sampleService.doWork(orderNumber);
        return Map.of("orderNumber", orderNumber, "status", "processed");
    }

    @PostMapping("/sync")
    public Map<String, String> sync() {
        return Map.of("result", sampleService.sync());
    }
}
