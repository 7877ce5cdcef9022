package works.jsonapi.jackson;

import tools.jackson.core.Version;
import tools.jackson.databind.JacksonModule;

/**
 * @see JsonApiSerializer#moduleFor
 */
public abstract class JsonApiJacksonModule extends JacksonModule {

	@Override
	public String getModuleName() {
		return getClass().getSimpleName();
	}

	@Override
	public Version version() {
		return Version.unknownVersion();
	}

}
