package github.sarthakdev143.photo_forge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PhotoForgeApplication {

	public static void main(String[] args) {
		SpringApplication.run(PhotoForgeApplication.class, args);
	}

}
