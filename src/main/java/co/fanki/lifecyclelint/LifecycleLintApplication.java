package co.fanki.lifecyclelint;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Lifecycle Lint command line application.
 *
 * <p>Runs one detector over a source tree and prints its findings: leaked
 * resources in Python and Java, forced unwraps after incomplete null
 * checks in Kotlin, Swift and Rust.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class LifecycleLintApplication {

    /**
     * Main entry point for the application.
     *
     * @param args the detector name, the target and detector flags
     */
    public static void main(final String[] args) {
        System.exit(SpringApplication.exit(
                SpringApplication.run(LifecycleLintApplication.class, args)));
    }

}
