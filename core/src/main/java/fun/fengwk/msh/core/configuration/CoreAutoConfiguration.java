package fun.fengwk.msh.core.configuration;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;

/**
 * Registers every core component for applications depending on the core module.
 *
 * @author fengwk
 */
@AutoConfiguration
@EnableConfigurationProperties
@ComponentScan(basePackages = "fun.fengwk.msh.core")
public class CoreAutoConfiguration {

}
