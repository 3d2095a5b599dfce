package app.threejs.catalog;

import app.threejs.catalog.tool.ThreejsToolAdapter;
import app.threejs.catalog.tool.ToolDescriptor;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class CatalogApplicationTests {

	@Autowired
	private ThreejsToolAdapter toolAdapter;

	@Test
	void contextLoads() {
		assertThat(toolAdapter.availableTools())
				.extracting(ToolDescriptor::name)
				.contains(ThreejsToolAdapter.SEARCH_MODELS);
	}

}
