package app.majid.aquifer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AquiferApplication {

	public static void main(String[] args) {
		SpringApplication.run(AquiferApplication.class, args);
	}

}
