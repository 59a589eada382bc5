package com.lingplug.cli.sample;

import com.lingplug.api.annotation.LingPlugin;
import com.lingplug.api.plugin.Plugin;

@LingPlugin(namespace = EchoPlugin.NAMESPACE, name = "shout")
public class ShoutPlugin implements Plugin {
}
