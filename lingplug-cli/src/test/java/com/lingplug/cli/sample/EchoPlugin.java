package com.lingplug.cli.sample;

import com.lingplug.api.annotation.LingPlugin;
import com.lingplug.api.plugin.Plugin;

@LingPlugin(namespace = EchoPlugin.NAMESPACE, name = "echo")
public class EchoPlugin implements Plugin {

    public static final String NAMESPACE = "lingplug.cli.test";
}
