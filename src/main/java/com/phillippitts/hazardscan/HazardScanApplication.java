package com.phillippitts.hazardscan;

import com.phillippitts.hazardscan.config.properties.BackendsProperties;
import com.phillippitts.hazardscan.config.properties.BudgetProperties;
import com.phillippitts.hazardscan.config.properties.CacheProperties;
import com.phillippitts.hazardscan.config.properties.DeviceProperties;
import com.phillippitts.hazardscan.config.properties.FallbackProperties;
import com.phillippitts.hazardscan.config.properties.ThreadPoolProperties;
import com.phillippitts.hazardscan.config.properties.ValidationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        ValidationProperties.class,
        CacheProperties.class,
        BudgetProperties.class,
        FallbackProperties.class,
        DeviceProperties.class,
        BackendsProperties.class,
        ThreadPoolProperties.class
})
public class HazardScanApplication {

    public static void main(String[] args) {
        SpringApplication.run(HazardScanApplication.class, args);
    }

}
