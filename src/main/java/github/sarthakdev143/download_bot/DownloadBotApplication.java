package github.sarthakdev143.download_bot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DownloadBotApplication {

	public static void main(String[] args) {
		SpringApplication.run(DownloadBotApplication.class, args);
		System.out.println("\r\n" + //
				"     _                     _                 _   _           _   \r\n" + //
				"  __| | _____      ___ __ | | ___   __ _  __| | | |__   ___ | |_ \r\n" + //
				" / _` |/ _ \\ \\ /\\ / / '_ \\| |/ _ \\ / _` |/ _` | | '_ \\ / _ \\| __|\r\n" + //
				"| (_| | (_) \\ V  V /| | | | | (_) | (_| | (_| | | |_) | (_) | |_ \r\n" + //
				" \\__,_|\\___/ \\_/\\_/ |_| |_|_|\\___/ \\__,_|\\__,_| |_.__/ \\___/ \\__|");
	}

}
