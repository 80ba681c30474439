package works.docsync.logging;

public final class MdcKeys {
	private MdcKeys() {}

	public static final String REGISTRY_NAME = "docsync.registry";
	public static final String REGISTRY_INSTANCE_ID = "docsync.instanceID";
	public static final String TYPE_NAME = "docsync.type";
}
